package com.gillianbc.forensicloss.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Either an explicit value supplied with the case or an instruction to consult the reference tables.
 * Each stage resolves its choice once, before computing.
 */
public sealed interface AssumptionChoice permits AssumptionChoice.UserOverride, AssumptionChoice.TableLookup {

    String OVERRIDE_SOURCE = "User override";

    static AssumptionChoice of(BigDecimal override) {
        return override == null ? TableLookup.INSTANCE : new UserOverride(override);
    }

    record UserOverride(BigDecimal value) implements AssumptionChoice {
        public UserOverride {
            Objects.requireNonNull(value, "override value must not be null");
        }
    }

    final class TableLookup implements AssumptionChoice {

        static final TableLookup INSTANCE = new TableLookup();

        private TableLookup() {
        }

        @Override
        public String toString() {
            return "TableLookup";
        }
    }
}
