package com.fundingarb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TradeStats {

    private int openTrades;
    private int closedTrades;
    private int abortedTrades;
    private int winningTrades;
    private BigDecimal totalRealizedPnl;
    private BigDecimal totalFees;
    private BigDecimal totalFundingCollected;
}
