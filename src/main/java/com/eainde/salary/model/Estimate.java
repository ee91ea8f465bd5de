package com.eainde.salary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;

/**
 * Salary range estimate. Either all three figures are set or none is.
 *
 * <p>There is no way to set the median on its own: {@link #of} clamps it into
 * {@code [min, max]} and {@link #scale} moves all three together.</p>
 */
@JsonPropertyOrder({"currency", "min", "max", "median"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Estimate(
        @JsonProperty("currency") String currency,
        @JsonProperty("min")      Long min,
        @JsonProperty("median")   Long median,
        @JsonProperty("max")      Long max
) implements Serializable {

    public Estimate {
        boolean anySet = min != null || median != null || max != null;
        boolean allSet = min != null && median != null && max != null;
        if (anySet && !allSet) {
            throw new IllegalArgumentException("Estimate must set min, median and max together");
        }
        if (allSet && (min > median || median > max)) {
            throw new IllegalArgumentException(
                    "Estimate requires min <= median <= max, got " + min + " / " + median + " / " + max);
        }
    }

    public static Estimate of(String currency, long min, long median, long max) {
        long lo = Math.min(min, max);
        long hi = Math.max(min, max);
        return new Estimate(currency, lo, Math.max(lo, Math.min(hi, median)), hi);
    }

    public static Estimate unset(String currency) {
        return new Estimate(currency, null, null, null);
    }

    @JsonIgnore
    public boolean isSet() {
        return median != null;
    }

    /**
     * Applies a multiplicative adjustment to the whole range.
     */
    public Estimate scale(double multiplier) {
        if (!isSet()) {
            return this;
        }
        return of(currency,
                Math.round(min * multiplier),
                Math.round(median * multiplier),
                Math.round(max * multiplier));
    }
}
