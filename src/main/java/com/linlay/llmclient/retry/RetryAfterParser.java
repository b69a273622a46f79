package com.linlay.llmclient.retry;

import org.springframework.http.HttpHeaders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Reads {@code Retry-After} as a number of seconds. HTTP-date values, garbage and values that do not
 * fit in a millisecond {@code long} yield {@code null}.
 */
public final class RetryAfterParser {

    public static final String HEADER = "Retry-After";

    private RetryAfterParser() {
    }

    public static Duration parse(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        return parse(headers.getFirst(HEADER));
    }

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            BigDecimal seconds = new BigDecimal(value.trim());
            if (seconds.signum() < 0) {
                return null;
            }
            return Duration.ofMillis(seconds.movePointRight(3).setScale(0, RoundingMode.UP).longValueExact());
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
    }
}
