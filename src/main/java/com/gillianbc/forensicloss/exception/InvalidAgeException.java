package com.gillianbc.forensicloss.exception;

import com.gillianbc.forensicloss.model.PipelineStage;

import java.math.BigDecimal;

public class InvalidAgeException extends ForensicLossException {

    private final BigDecimal age;

    public InvalidAgeException(BigDecimal age, String reason) {
        super(PipelineStage.LIFE_EXPECTANCY, "Invalid age " + age.toPlainString() + ": " + reason);
        this.age = age;
    }

    public BigDecimal getAge() {
        return age;
    }
}
