package com.gillianbc.forensicloss.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * The decedent. The evaluation date is normally the date of death.
 */
@Getter
@Builder
@Jacksonized
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Person {

    @JsonAlias("first_name")
    private final String firstName;
    @JsonAlias("last_name")
    private final String lastName;
    @JsonAlias({"dob", "date_of_birth"})
    private final LocalDate dateOfBirth;
    @JsonAlias({"dod", "evaluation_date"})
    private final LocalDate evaluationDate;
    private final Sex sex;
    @JsonAlias("education_level")
    private final EducationLevel educationLevel;
    @JsonAlias("active_status")
    @Builder.Default
    private final ActiveStatus activeStatus = ActiveStatus.ACTIVE;

    public String fullName() {
        if (firstName == null && lastName == null) {
            return "";
        }
        if (firstName == null) {
            return lastName;
        }
        return lastName == null ? firstName : firstName + " " + lastName;
    }
}
