package com.fundingarb.domain.model;

import com.fundingarb.exception.BaseException;
import lombok.Getter;

/**
 * Outcome of {@code ExecutionEngine.execute}. A failed result may still carry the trade record
 * (aborted, possibly rolled back) so the caller can inspect what happened.
 */
@Getter
public class ExecutionResult {

    private final boolean success;
    private final Trade trade;
    private final BaseException error;

    private ExecutionResult(boolean success, Trade trade, BaseException error) {
        this.success = success;
        this.trade = trade;
        this.error = error;
    }

    public static ExecutionResult success(Trade trade) {
        return new ExecutionResult(true, trade, null);
    }

    public static ExecutionResult failure(Trade trade, BaseException error) {
        return new ExecutionResult(false, trade, error);
    }

    public static ExecutionResult failure(BaseException error) {
        return new ExecutionResult(false, null, error);
    }
}
