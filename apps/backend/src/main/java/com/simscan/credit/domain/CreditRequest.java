package com.simscan.credit.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditRequest {

    private Long id;

    private Long userId;

    /** 仅在 listPending 的 join 查询里有值 */
    private String username;

    private Integer amount;

    /** pending / approved / rejected */
    private String status;

    private LocalDateTime requestedAt;

    private LocalDateTime decidedAt;

    private Long decidedBy;

    public boolean isPending() {
        return CreditRequestStatus.PENDING.code().equals(status);
    }
}
