package com.fundingarb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Outcome of closing (or partially closing) a trade. */
@Data
@Builder
public class CloseResult {

    private String tradeId;
    private boolean success;

    /** True when the call was a no-op because another close already owns the trade. */
    private boolean skipped;

    private String reason;

    @Builder.Default
    private BigDecimal residualLeg1 = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal residualLeg2 = BigDecimal.ZERO;

    private BigDecimal realizedPnl;
    private String message;

    public static CloseResult skipped(String tradeId, String message) {
        return CloseResult.builder().tradeId(tradeId).skipped(true).message(message).build();
    }
}
