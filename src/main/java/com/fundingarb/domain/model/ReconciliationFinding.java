package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.ReconcileAction;
import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** One divergence found by a reconciliation pass and the action taken for it. */
@Data
@Builder
public class ReconciliationFinding {

    private String symbol;
    private String tradeId;
    private Venue venue;
    private ReconcileAction action;

    /** Absolute quantity difference for {@code quantity_mismatch}. */
    private BigDecimal delta;

    private BigDecimal expectedQty;
    private BigDecimal actualQty;
    private String detail;
}
