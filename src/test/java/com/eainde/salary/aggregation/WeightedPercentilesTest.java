package com.eainde.salary.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeightedPercentilesTest {

    @Nested
    @DisplayName("percentile")
    class Percentile {

        @Test
        @DisplayName("should return the smallest value reaching the cumulative weight")
        void lowerStep() {
            List<WeightedValue> values = List.of(
                    new WeightedValue(10, 1), new WeightedValue(20, 1),
                    new WeightedValue(30, 1), new WeightedValue(40, 1));

            assertThat(WeightedPercentiles.percentile(values, 0.10)).isEqualTo(10);
            assertThat(WeightedPercentiles.percentile(values, 0.50)).isEqualTo(20);
            assertThat(WeightedPercentiles.percentile(values, 0.90)).isEqualTo(40);
        }

        @Test
        @DisplayName("should let heavy values pull the percentile towards them")
        void weighted() {
            List<WeightedValue> values = List.of(
                    new WeightedValue(100, 0.1), new WeightedValue(200, 0.1), new WeightedValue(300, 5.0));

            assertThat(WeightedPercentiles.percentile(values, 0.5)).isEqualTo(300);
        }

        @Test
        @DisplayName("should not depend on input order")
        void orderIndependent() {
            List<WeightedValue> a = List.of(new WeightedValue(3, 1), new WeightedValue(1, 2), new WeightedValue(2, 1));
            List<WeightedValue> b = List.of(new WeightedValue(2, 1), new WeightedValue(3, 1), new WeightedValue(1, 2));

            assertThat(WeightedPercentiles.percentile(a, 0.5)).isEqualTo(WeightedPercentiles.percentile(b, 0.5));
        }

        @Test
        @DisplayName("should reject empty samples and out-of-range percentiles")
        void rejectsBadInput() {
            assertThatThrownBy(() -> WeightedPercentiles.percentile(List.of(), 0.5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> WeightedPercentiles.percentile(List.of(new WeightedValue(1, 1)), 1.5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> WeightedPercentiles.percentile(List.of(new WeightedValue(1, 0)), 0.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("median and MAD")
    class Robust {

        @Test
        @DisplayName("should average the middle pair of an even sample")
        void evenMedian() {
            assertThat(WeightedPercentiles.median(List.of(4.0, 1.0, 3.0, 2.0))).isEqualTo(2.5);
        }

        @Test
        @DisplayName("should compute the median absolute deviation")
        void mad() {
            List<Double> values = List.of(1.0, 2.0, 3.0, 4.0, 100.0);
            double median = WeightedPercentiles.median(values);

            assertThat(median).isEqualTo(3.0);
            assertThat(WeightedPercentiles.medianAbsoluteDeviation(values, median)).isEqualTo(1.0);
        }
    }
}
