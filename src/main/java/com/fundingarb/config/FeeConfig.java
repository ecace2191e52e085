package com.fundingarb.config;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fee schedule per venue as fractions of notional. Used when the venue does not report a fee.
 */
@Data
@Component
@ConfigurationProperties(prefix = "funding.fees")
public class FeeConfig {

    private Map<Venue, BigDecimal> maker = new EnumMap<>(Map.of(
            Venue.LIGHTER, new BigDecimal("0.00002"),
            Venue.X10, BigDecimal.ZERO));

    private Map<Venue, BigDecimal> taker = new EnumMap<>(Map.of(
            Venue.LIGHTER, new BigDecimal("0.0002"),
            Venue.X10, new BigDecimal("0.000225")));

    public BigDecimal makerFee(Venue venue) {
        return maker.getOrDefault(venue, BigDecimal.ZERO);
    }

    public BigDecimal takerFee(Venue venue) {
        return taker.getOrDefault(venue, BigDecimal.ZERO);
    }
}
