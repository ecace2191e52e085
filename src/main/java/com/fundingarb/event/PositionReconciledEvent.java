package com.fundingarb.event;

import com.fundingarb.domain.enums.ReconcileAction;
import com.fundingarb.domain.model.ReconciliationFinding;

/** One event per corrective action (or alert-only finding) of a reconciliation pass. */
public class PositionReconciledEvent extends DomainEvent {

    private final ReconciliationFinding finding;

    public PositionReconciledEvent(Object source, ReconciliationFinding finding) {
        super(source, finding.getSymbol(), finding.getTradeId());
        this.finding = finding;
    }

    public ReconciliationFinding getFinding() {
        return finding;
    }

    public ReconcileAction getAction() {
        return finding.getAction();
    }
}
