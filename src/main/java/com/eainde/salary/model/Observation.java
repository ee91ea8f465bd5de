package com.eainde.salary.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One salary data point with its provenance.
 *
 * <p>A single figure is stored as {@code low == high}. Observations are never
 * mutated; aggregation only selects, drops or derives from them.</p>
 *
 * @param low        lower bound of the figure (equal to {@code high} for a single value)
 * @param high       upper bound of the figure
 * @param currency   ISO currency code, upper case
 * @param source     origin identifier ({@code internal_kb}, a domain name, ...)
 * @param origin     which provider family produced it
 * @param weightHint provider reliability signal in [0,1], or null to use the origin prior
 * @param rawText    provenance snippet, or null
 */
public record Observation(
        long low,
        long high,
        String currency,
        String source,
        ObservationOrigin origin,
        Double weightHint,
        String rawText
) implements Serializable {

    public static final String DEFAULT_CURRENCY = "USD";

    public Observation {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(origin, "origin");
        currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency.trim().toUpperCase();
        if (weightHint != null) {
            weightHint = weightHint.isNaN() ? null : Math.max(0.0, Math.min(1.0, weightHint));
        }
    }

    public static Observation single(long amount, String source, ObservationOrigin origin,
                                     Double weightHint, String rawText) {
        return new Observation(amount, amount, DEFAULT_CURRENCY, source, origin, weightHint, rawText);
    }

    public static Observation range(long low, long high, String source, ObservationOrigin origin,
                                    Double weightHint, String rawText) {
        return new Observation(low, high, DEFAULT_CURRENCY, source, origin, weightHint, rawText);
    }

    public double midpoint() {
        return (low + high) / 2.0;
    }

    public boolean isRange() {
        return low != high;
    }
}
