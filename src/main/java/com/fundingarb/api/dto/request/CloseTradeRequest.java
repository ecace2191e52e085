package com.fundingarb.api.dto.request;

import lombok.Data;

@Data
public class CloseTradeRequest {

    private String reason;

    /** Skips the maker phase and closes with taker orders. */
    private boolean emergency;
}
