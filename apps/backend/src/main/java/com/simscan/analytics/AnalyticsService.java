package com.simscan.analytics;

import com.simscan.config.ScanProperties;
import com.simscan.corpus.CorpusStore;
import com.simscan.document.domain.CorpusDocument;
import com.simscan.mapper.DocumentMapper;
import com.simscan.mapper.model.UserScanCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin dashboard figures: scan totals, most active users and the most common words in the corpus.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    static final int TOP_WORDS = 10;

    private final DocumentMapper documentMapper;
    private final CorpusStore corpusStore;
    private final ScanProperties scanProps;

    public record WordCount(String word, long count) {}

    public record Report(long totalScans, List<UserScanCount> topUsers, List<WordCount> mostCommonTopics) {}

    public Mono<Report> report() {
        Mono<Long> total = Mono.fromCallable(documentMapper::countAll)
                .subscribeOn(Schedulers.boundedElastic());
        Mono<List<UserScanCount>> topUsers = Mono.fromCallable(documentMapper::selectScanCountsByUser)
                .subscribeOn(Schedulers.boundedElastic());

        return Mono.zip(total, topUsers, mostCommonWords())
                .map(t -> new Report(t.getT1(), t.getT2(), t.getT3()));
    }

    private Mono<List<WordCount>> mostCommonWords() {
        return Mono.fromCallable(documentMapper::selectAll)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .concatMap(this::readQuietly)
                .reduceWith(HashMap<String, Long>::new, (freq, text) -> {
                    for (String word : text.split("\\s+")) {
                        if (!word.isEmpty()) {
                            freq.merge(word, 1L, Long::sum);
                        }
                    }
                    return freq;
                })
                .map(AnalyticsService::top);
    }

    private Mono<String> readQuietly(CorpusDocument doc) {
        return corpusStore.read(doc.getStorageKey(), scanProps.getStorageTimeout())
                .onErrorResume(e -> {
                    log.warn("[ANALYTICS] skipping unreadable document id={} key={}: {}",
                            doc.getId(), doc.getStorageKey(), e.getMessage());
                    return Mono.empty();
                });
    }

    static List<WordCount> top(Map<String, Long> freq) {
        return freq.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_WORDS)
                .map(e -> new WordCount(e.getKey(), e.getValue()))
                .toList();
    }
}
