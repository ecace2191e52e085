package com.fundingarb.unit.support;

import com.fundingarb.adapter.ExchangeRegistry;
import com.fundingarb.domain.enums.Venue;
import com.fundingarb.simulator.PaperExchange;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/** Both venues as paper exchanges sharing one clock, with a book on every listed symbol. */
public final class PaperVenues {

    public static final BigDecimal BALANCE = new BigDecimal("10000");
    public static final BigDecimal MAKER_FEE = new BigDecimal("0.0002");
    public static final BigDecimal TAKER_FEE = new BigDecimal("0.0005");

    private final PaperExchange lighter;
    private final PaperExchange x10;
    private final ExchangeRegistry registry;

    public PaperVenues(Clock clock, String... symbols) {
        lighter = new PaperExchange(Venue.LIGHTER, clock, BALANCE, MAKER_FEE, TAKER_FEE, Duration.ofSeconds(2));
        x10 = new PaperExchange(Venue.X10, clock, BALANCE, MAKER_FEE, TAKER_FEE, Duration.ofSeconds(2));
        for (String symbol : symbols) {
            setBook(symbol, new BigDecimal("99.9"), new BigDecimal("100.1"), new BigDecimal("1000"));
        }
        registry = new ExchangeRegistry(Map.of(Venue.LIGHTER, lighter, Venue.X10, x10));
    }

    public void setBook(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal qty) {
        lighter.setBook(symbol, bid, ask, qty);
        x10.setBook(symbol, bid, ask, qty);
    }

    public PaperExchange lighter() {
        return lighter;
    }

    public PaperExchange x10() {
        return x10;
    }

    public ExchangeRegistry registry() {
        return registry;
    }
}
