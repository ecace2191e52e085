package com.fundingarb.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.fundingarb.config.ExecutionConfig;
import com.fundingarb.domain.enums.AttemptSchedule;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.oms.MakerPricing;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MakerPricingTest {

    private final MarketInfo info = MarketInfo.builder().symbol("BTC").tickSize(new BigDecimal("0.01")).build();
    private ExecutionConfig config;

    @BeforeEach
    void setUp() {
        config = new ExecutionConfig();
    }

    private static OrderbookSnapshot book(String bid, String ask) {
        return OrderbookSnapshot.builder()
                .symbol("BTC")
                .bestBid(new BigDecimal(bid))
                .bestBidQty(BigDecimal.TEN)
                .bestAsk(new BigDecimal(ask))
                .bestAskQty(BigDecimal.TEN)
                .build();
    }

    @Nested
    @DisplayName("Aggressiveness")
    class Aggressiveness {

        @Test
        @DisplayName("Ramps linearly across attempts and is capped at the configured maximum")
        void linearRampCapped() {
            assertThat(MakerPricing.aggressiveness(0, 5, BigDecimal.ONE, BigDecimal.TEN, config))
                    .isEqualByComparingTo("0");
            assertThat(MakerPricing.aggressiveness(1, 5, BigDecimal.ONE, BigDecimal.TEN, config))
                    .isEqualByComparingTo("0.25");
            assertThat(MakerPricing.aggressiveness(4, 5, BigDecimal.ONE, BigDecimal.TEN, config))
                    .isEqualByComparingTo("0.5");
        }

        @Test
        @DisplayName("A large size relative to top of book raises the floor")
        void depthFloor() {
            // utilisation 0.9 over trigger 0.7: floor 0.25 + 0.75 * 0.1
            assertThat(MakerPricing.aggressiveness(0, 5, new BigDecimal("9"), BigDecimal.TEN, config))
                    .isEqualByComparingTo("0.325");
        }

        @Test
        @DisplayName("Without smart pricing the depth floor does not apply")
        void smartPricingDisabled() {
            config.setSmartPricingEnabled(false);

            assertThat(MakerPricing.aggressiveness(0, 5, new BigDecimal("9"), BigDecimal.TEN, config))
                    .isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("A single attempt stays passive")
        void singleAttempt() {
            assertThat(MakerPricing.aggressiveness(0, 1, BigDecimal.ONE, BigDecimal.ZERO, config))
                    .isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Maker price")
    class MakerPrice {

        @Test
        @DisplayName("BUY moves from the bid toward one tick below the ask, rounded up")
        void buy() {
            assertThat(MakerPricing.makerPrice(Side.BUY, book("100", "101"), BigDecimal.ZERO, info))
                    .isEqualByComparingTo("100");
            assertThat(MakerPricing.makerPrice(Side.BUY, book("100", "101"), new BigDecimal("0.5"), info))
                    .isEqualByComparingTo("100.50");
            assertThat(MakerPricing.makerPrice(Side.BUY, book("100", "101"), BigDecimal.ONE, info))
                    .isEqualByComparingTo("100.99");
        }

        @Test
        @DisplayName("SELL moves from the ask toward one tick above the bid, rounded down")
        void sell() {
            assertThat(MakerPricing.makerPrice(Side.SELL, book("100", "101"), new BigDecimal("0.5"), info))
                    .isEqualByComparingTo("100.50");
            assertThat(MakerPricing.makerPrice(Side.SELL, book("100", "101"), BigDecimal.ONE, info))
                    .isEqualByComparingTo("100.01");
        }

        @Test
        @DisplayName("A one-tick book keeps the price at our own best")
        void oneTickBook() {
            assertThat(MakerPricing.makerPrice(Side.BUY, book("100", "100.01"), BigDecimal.ONE, info))
                    .isEqualByComparingTo("100");
            assertThat(MakerPricing.makerPrice(Side.SELL, book("100", "100.01"), BigDecimal.ONE, info))
                    .isEqualByComparingTo("100.01");
        }
    }

    @Nested
    @DisplayName("Attempt timeouts")
    class AttemptTimeouts {

        @Test
        @DisplayName("INCREASING gives attempt n a share proportional to n")
        void increasing() {
            assertThat(MakerPricing.attemptTimeouts(Duration.ofSeconds(10), 4, Duration.ofMillis(500),
                    AttemptSchedule.INCREASING))
                    .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3),
                            Duration.ofSeconds(4));
        }

        @Test
        @DisplayName("EQUAL splits the budget evenly")
        void equal() {
            assertThat(MakerPricing.attemptTimeouts(Duration.ofSeconds(10), 4, Duration.ofMillis(500),
                    AttemptSchedule.EQUAL))
                    .containsOnly(Duration.ofMillis(2500))
                    .hasSize(4);
        }

        @Test
        @DisplayName("No attempt gets less than the minimum")
        void minimumPerAttempt() {
            assertThat(MakerPricing.attemptTimeouts(Duration.ofSeconds(1), 4, Duration.ofMillis(500),
                    AttemptSchedule.INCREASING))
                    .containsOnly(Duration.ofMillis(500));
        }
    }

    @Nested
    @DisplayName("Hedge limit price")
    class HedgeLimit {

        @Test
        @DisplayName("Slippage widens per attempt up to the maximum")
        void widensPerAttempt() {
            BigDecimal base = new BigDecimal("100");

            assertThat(MakerPricing.hedgeLimitPrice(Side.BUY, base, 0, config, info)).isEqualByComparingTo("100.10");
            assertThat(MakerPricing.hedgeLimitPrice(Side.BUY, base, 2, config, info)).isEqualByComparingTo("100.20");
            assertThat(MakerPricing.hedgeLimitPrice(Side.BUY, base, 10, config, info)).isEqualByComparingTo("100.30");
        }

        @Test
        @DisplayName("SELL prices below the base")
        void sellBelowBase() {
            assertThat(MakerPricing.hedgeLimitPrice(Side.SELL, new BigDecimal("100"), 0, config, info))
                    .isEqualByComparingTo("99.90");
        }
    }
}
