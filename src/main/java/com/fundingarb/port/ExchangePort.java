package com.fundingarb.port;

import com.fundingarb.domain.enums.Venue;
import com.fundingarb.domain.model.Balance;
import com.fundingarb.domain.model.FundingRate;
import com.fundingarb.domain.model.MarketInfo;
import com.fundingarb.domain.model.Order;
import com.fundingarb.domain.model.OrderRequest;
import com.fundingarb.domain.model.OrderbookDepthSnapshot;
import com.fundingarb.domain.model.OrderbookSnapshot;
import com.fundingarb.domain.model.Position;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Everything the engine needs from one trading venue.
 *
 * <p>Implementations own the wire protocol (REST, WebSocket, signing, symbol mapping). Methods
 * block until the venue answers and throw {@link com.fundingarb.exception.ExchangeException}
 * (or a subclass) on failure. Order rejections surface as
 * {@link com.fundingarb.exception.OrderRejectedException}, and insufficient margin as
 * {@link com.fundingarb.exception.InsufficientBalanceException}.
 */
public interface ExchangePort {

    Venue getVenue();

    /** Symbols tradable on this venue, in the engine's normalised naming. */
    List<String> listSymbols();

    Order placeOrder(OrderRequest request);

    void cancelOrder(String symbol, String orderId);

    Optional<Order> getOrder(String symbol, String orderId);

    List<Order> getOpenOrders(String symbol);

    /** Live position for the symbol, or empty when flat. */
    Optional<Position> getPosition(String symbol);

    List<Position> listPositions();

    Balance getAvailableBalance();

    OrderbookSnapshot getOrderbookL1(String symbol);

    OrderbookDepthSnapshot getOrderbookDepth(String symbol, int levels);

    FundingRate getFundingRate(String symbol);

    BigDecimal getMarkPrice(String symbol);

    MarketInfo getMarketInfo(String symbol);

    /**
     * Registers a listener for order updates pushed by the venue. Listeners are called on the
     * venue's own thread and must not block.
     */
    void subscribeOrders(Consumer<Order> listener);
}
