package com.gillianbc.forensicloss.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

@Getter
@EqualsAndHashCode
@ToString
public class DiscountFactorSchedule {

    private final BigDecimal rate;
    private final boolean overridden;
    private final List<DiscountFactor> factors;

    public DiscountFactorSchedule(BigDecimal rate, boolean overridden, List<DiscountFactor> factors) {
        this.rate = Objects.requireNonNull(rate, "rate must not be null");
        this.overridden = overridden;
        this.factors = List.copyOf(Objects.requireNonNull(factors, "factors must not be null"));
    }

    public BigDecimal factorAt(int position) {
        return factors.get(position).factor();
    }

    public int size() {
        return factors.size();
    }

    public record DiscountFactor(int yearIndex, BigDecimal factor) {

        public DiscountFactor {
            Objects.requireNonNull(factor, "factor must not be null");
        }
    }
}
