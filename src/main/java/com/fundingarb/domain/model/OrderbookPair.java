package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import lombok.AllArgsConstructor;
import lombok.Data;

/** L1 snapshots of the same symbol on both venues. */
@Data
@AllArgsConstructor
public class OrderbookPair {

    private OrderbookSnapshot lighter;
    private OrderbookSnapshot x10;

    public OrderbookSnapshot get(Venue venue) {
        return venue == Venue.LIGHTER ? lighter : x10;
    }

    public boolean bothHaveDepth() {
        return lighter != null && x10 != null && lighter.hasDepth() && x10.hasDepth();
    }
}
