package com.gillianbc.forensicloss.report;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gillianbc.forensicloss.model.CaseSummary;

import java.util.List;
import java.util.Map;

/**
 * Layout of summary.json: headline figures, the files written and the audit block.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SummaryDocument(String caseId,
                              CaseSummary summary,
                              Map<String, String> files,
                              Audit audit) {

    /**
     * @param sources distinct source documents cited
     * @param notes   how each assumption was arrived at for this case
     */
    public record Audit(List<String> sources, List<String> notes) {
    }
}
