package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.OrderType;
import com.fundingarb.domain.enums.Side;
import com.fundingarb.domain.enums.TimeInForce;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Parameters for {@code ExchangePort.placeOrder}. Price is required for LIMIT orders only. */
@Data
@Builder
public class OrderRequest {

    private String symbol;
    private Side side;
    private OrderType type;

    @Builder.Default
    private TimeInForce timeInForce = TimeInForce.GTC;

    private BigDecimal quantity;
    private BigDecimal price;
    private boolean reduceOnly;
    private String clientOrderId;

    public static OrderRequest limit(String symbol, Side side, BigDecimal qty, BigDecimal price, TimeInForce tif) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.LIMIT)
                .timeInForce(tif)
                .quantity(qty)
                .price(price)
                .build();
    }

    public static OrderRequest reduceOnlyLimit(
            String symbol, Side side, BigDecimal qty, BigDecimal price, TimeInForce tif) {
        OrderRequest request = limit(symbol, side, qty, price, tif);
        request.setReduceOnly(true);
        return request;
    }

    public static OrderRequest reduceOnlyMarket(String symbol, Side side, BigDecimal qty) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(side)
                .type(OrderType.MARKET)
                .timeInForce(TimeInForce.IOC)
                .quantity(qty)
                .reduceOnly(true)
                .build();
    }
}
