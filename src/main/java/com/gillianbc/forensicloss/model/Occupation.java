package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Occupation {

    /** Standard Occupational Classification code, e.g. 11-2022. */
    @JsonAlias("soc_code")
    private final String socCode;
    private final String title;
    private final String county;
    private final String state;
    /** Annual salary in USD at the evaluation date. */
    @JsonAlias({"base_salary_usd", "base_salary"})
    private final BigDecimal baseSalary;

    /**
     * @return the SOC major group (the two digits before the hyphen), used as the wage growth category
     */
    public String majorGroup() {
        return socCode.substring(0, 2);
    }

    public String location() {
        if (county == null && state == null) {
            return "unspecified location";
        }
        if (county == null) {
            return state;
        }
        return state == null ? county : county + ", " + state;
    }
}
