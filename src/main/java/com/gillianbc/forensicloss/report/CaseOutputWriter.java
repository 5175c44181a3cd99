package com.gillianbc.forensicloss.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.forensicloss.config.ForensicLossProperties;
import com.gillianbc.forensicloss.exception.CaseFileException;
import com.gillianbc.forensicloss.model.AuditEntry;
import com.gillianbc.forensicloss.model.CaseResult;
import com.gillianbc.forensicloss.model.GrowthSchedule;
import com.gillianbc.forensicloss.model.GrowthSchedule.GrowthYear;
import com.gillianbc.forensicloss.model.LifeExpectancyResult;
import com.gillianbc.forensicloss.model.WorkLifeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes summary.json and report.html for a case into {@code <output-directory>/<case-id>/}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseOutputWriter {

    static final String SUMMARY_FILE = "summary.json";
    static final String REPORT_FILE = "report.html";

    private final ObjectMapper objectMapper;
    private final LossReportService reportService;
    private final ForensicLossProperties properties;

    /**
     * @return the case directory
     */
    public Path write(CaseResult result) {
        Path caseDir = caseDirectory(result.getConfig().getCaseId());
        try {
            Files.createDirectories(caseDir);

            Path reportPath = caseDir.resolve(REPORT_FILE);
            Files.writeString(reportPath, reportService.renderHtml(result), StandardCharsets.UTF_8);

            Path summaryPath = caseDir.resolve(SUMMARY_FILE);
            Map<String, String> files = new LinkedHashMap<>();
            files.put("report_html_path", reportPath.toString());
            files.put("summary_json_path", summaryPath.toString());
            SummaryDocument document = new SummaryDocument(result.getConfig().getCaseId(), result.summary(), files,
                    new SummaryDocument.Audit(auditSources(result.getAuditEntries()), auditNotes(result)));
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryPath.toFile(), document);

            log.info("Case {} outputs saved to: {}", result.getConfig().getCaseId(), caseDir.toAbsolutePath());
            return caseDir;
        } catch (IOException e) {
            log.error("Failed to write outputs for case {} to {}", result.getConfig().getCaseId(), caseDir, e);
            throw new CaseFileException("Failed to write case outputs to " + caseDir, e);
        }
    }

    /**
     * Resolves the case directory under the output root.
     *
     * @throws CaseFileException if the case id would place it anywhere else
     */
    Path caseDirectory(String caseId) {
        Path root = Paths.get(properties.getOutputDirectory()).toAbsolutePath().normalize();
        Path caseDir = root.resolve(caseId).normalize();
        if (!caseDir.startsWith(root) || caseDir.equals(root)) {
            log.error("Case id '{}' resolves outside the output directory {}", caseId, root);
            throw new CaseFileException("Case id '" + caseId + "' does not name a directory under " + root);
        }
        return caseDir;
    }

    /**
     * Distinct source documents cited, in first-use order.
     */
    static List<String> auditSources(List<AuditEntry> entries) {
        Set<String> sources = new LinkedHashSet<>();
        for (AuditEntry entry : entries) {
            sources.add(entry.sourceLabel());
        }
        return List.copyOf(sources);
    }

    static List<String> auditNotes(CaseResult result) {
        List<String> notes = new ArrayList<>();

        LifeExpectancyResult lifeExpectancy = result.getLifeExpectancy();
        if (lifeExpectancy.isOverridden()) {
            notes.add("Life expectancy taken from user override");
        } else {
            notes.add("Life expectancy looked up in " + lifeExpectancy.getCitation().sourceLabel());
        }

        WorkLifeResult workLife = result.getWorkLife();
        switch (workLife.getBasis()) {
            case INACTIVE -> notes.add("Worklife expectancy is zero for a person not active in the labour force");
            case OVERRIDE -> notes.add("Worklife expectancy taken from user override");
            case RETIREMENT_AGE_HINT -> notes.add("Worklife expectancy derived from retirement age hint");
            case TABLE -> notes.add("Worklife expectancy derived from participation factor in "
                    + workLife.getCitation().sourceLabel());
        }
        if (workLife.isClamped()) {
            notes.add("Worklife expectancy capped at remaining life expectancy");
        }

        GrowthSchedule growth = result.getGrowthSchedule();
        if (growth.isOverridden()) {
            notes.add("Wage growth taken from user override");
        } else {
            growth.getYears().stream()
                    .filter(GrowthYear::carriedForward)
                    .findFirst()
                    .ifPresent(first -> notes.add("Wage growth from " + first.calendarYear()
                            + " onwards carries forward the last published year"));
        }
        notes.add("Historical wage series reconstructed from base salary at the average growth rate");

        if (result.getDiscountFactors().isOverridden()) {
            notes.add("Discount rate taken from user override");
        }
        return List.copyOf(notes);
    }
}
