package com.fundingarb.adapter;

import com.fundingarb.domain.enums.Venue;
import com.fundingarb.port.ExchangePort;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** The venue adapters the engine trades on, keyed by venue. */
public class ExchangeRegistry {

    private final Map<Venue, ExchangePort> exchanges;

    public ExchangeRegistry(Map<Venue, ExchangePort> exchanges) {
        for (Venue venue : Venue.values()) {
            if (!exchanges.containsKey(venue)) {
                throw new IllegalArgumentException("No exchange adapter registered for " + venue);
            }
        }
        this.exchanges = Collections.unmodifiableMap(new EnumMap<>(exchanges));
    }

    public ExchangePort get(Venue venue) {
        return exchanges.get(venue);
    }

    public ExchangePort lighter() {
        return exchanges.get(Venue.LIGHTER);
    }

    public ExchangePort x10() {
        return exchanges.get(Venue.X10);
    }

    public Collection<ExchangePort> all() {
        return exchanges.values();
    }
}
