package com.fundingarb.oms;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * One lock per symbol, shared by entry execution, closing and reconciliation so that only one of
 * them touches a symbol's orders at a time.
 */
@Component
public class SymbolLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }

    public boolean isLocked(String symbol) {
        ReentrantLock lock = locks.get(symbol);
        return lock != null && lock.isLocked();
    }
}
