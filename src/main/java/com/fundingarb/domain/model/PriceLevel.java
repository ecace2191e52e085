package com.fundingarb.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PriceLevel {

    private BigDecimal price;
    private BigDecimal qty;
}
