package com.fundingarb.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/** Success envelope. {@code asOf} comes from the engine clock; {@code count} is set for collections. */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant asOf;

    private ApiResponse(T data, Instant asOf) {
        this.data = data;
        this.count = data instanceof Collection ? ((Collection<?>) data).size() : null;
        this.asOf = asOf;
    }

    public static <T> ApiResponse<T> of(T data, Clock clock) {
        return new ApiResponse<>(data, clock.instant());
    }
}
