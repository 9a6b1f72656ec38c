package com.simscan.scan;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One stored document that scored above the threshold.
 *
 * @param similarityPercent score * 100 rounded to two decimals
 */
public record Match(String fileName, double similarityPercent) {

    public static Match of(String fileName, double score) {
        double percent = BigDecimal.valueOf(score * 100)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        return new Match(fileName, percent);
    }
}
