package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * Fully resolved input for one case run.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class CaseConfig {

    @JsonAlias("case_id")
    private final String caseId;
    private final Person person;
    private final Occupation occupation;
    @Builder.Default
    private final Assumptions assumptions = Assumptions.none();
}
