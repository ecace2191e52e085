package com.fundingarb.domain.enums;

public enum OrderType {
    LIMIT,
    MARKET
}
