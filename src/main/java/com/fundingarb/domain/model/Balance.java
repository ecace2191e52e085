package com.fundingarb.domain.model;

import com.fundingarb.domain.enums.Venue;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Balance {

    private Venue venue;
    private BigDecimal available;
    private BigDecimal total;
}
