package com.gillianbc.forensicloss.report;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.forensicloss.TestCases;
import com.gillianbc.forensicloss.config.ForensicLossProperties;
import com.gillianbc.forensicloss.exception.CaseFileException;
import com.gillianbc.forensicloss.model.Assumptions;
import com.gillianbc.forensicloss.model.CaseConfig;
import com.gillianbc.forensicloss.model.CaseResult;
import com.gillianbc.forensicloss.tables.FakeTables;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaseOutputWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path outputDir;

    private CaseOutputWriter writer(Path directory) {
        ForensicLossProperties properties = new ForensicLossProperties();
        properties.setOutputDirectory(directory.toString());
        return new CaseOutputWriter(objectMapper, new LossReportService(), properties);
    }

    private CaseResult result() {
        return TestCases.service(FakeTables.tables()).run(TestCases.caseConfig(
                TestCases.personAged44().build(), Assumptions.none()));
    }

    @Test
    @DisplayName("Writes summary.json and report.html under <output>/<case-id>/")
    void writesCaseDirectory() throws IOException {
        CaseResult result = result();
        Path caseDir = writer(outputDir).write(result);

        assertEquals(outputDir.resolve("case_001"), caseDir);
        assertTrue(Files.isRegularFile(caseDir.resolve(CaseOutputWriter.REPORT_FILE)));
        assertTrue(Files.isRegularFile(caseDir.resolve(CaseOutputWriter.SUMMARY_FILE)));

        JsonNode summary = objectMapper.reader()
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .readTree(Files.readString(caseDir.resolve(CaseOutputWriter.SUMMARY_FILE)));
        assertEquals("case_001", summary.get("case_id").asText());
        assertEquals(0, result.getTotalLoss()
                .compareTo(summary.get("summary").get("total_economic_loss_usd").decimalValue()));
        assertEquals(57, summary.get("summary").get("life_expectancy_years").asInt());
        assertEquals(4, summary.get("summary").get("discount_rate_pct").asInt());
        assertTrue(summary.get("files").get("report_html_path").asText().endsWith(CaseOutputWriter.REPORT_FILE));
        List<String> sources = new ArrayList<>();
        summary.get("audit").get("sources").forEach(source -> sources.add(source.asText()));
        assertEquals(List.of("Fake life table", "Fake worklife tables", "Fake wage series", "Case configuration",
                "Fake treasury"), sources);
        List<String> notes = new ArrayList<>();
        summary.get("audit").get("notes").forEach(note -> notes.add(note.asText()));
        assertEquals(CaseOutputWriter.auditNotes(result), notes);
    }

    @Test
    @DisplayName("Audit notes say how each assumption was arrived at")
    void auditNotes() {
        assertThat(CaseOutputWriter.auditNotes(result())).containsExactly(
                "Life expectancy looked up in Fake life table",
                "Worklife expectancy derived from participation factor in Fake worklife tables",
                "Wage growth from 2027 onwards carries forward the last published year",
                "Historical wage series reconstructed from base salary at the average growth rate");

        CaseResult overridden = TestCases.service(FakeTables.tables()).run(TestCases.caseConfig(
                TestCases.personAged44().build(), Assumptions.builder()
                        .lifeExpectancyOverrideYears(new BigDecimal("30"))
                        .workLifeOverrideYears(new BigDecimal("40"))
                        .wageGrowthRateOverride(new BigDecimal("0.03"))
                        .discountRateOverride(new BigDecimal("0.04"))
                        .build()));
        assertThat(CaseOutputWriter.auditNotes(overridden)).containsExactly(
                "Life expectancy taken from user override",
                "Worklife expectancy taken from user override",
                "Worklife expectancy capped at remaining life expectancy",
                "Wage growth taken from user override",
                "Historical wage series reconstructed from base salary at the average growth rate",
                "Discount rate taken from user override");
    }

    @Test
    @DisplayName("Writing twice overwrites the same files")
    void rewrite() throws IOException {
        CaseResult result = result();
        CaseOutputWriter writer = writer(outputDir);
        Path first = writer.write(result);
        Path second = writer.write(result);

        assertEquals(first, second);
        try (var files = Files.list(second)) {
            assertEquals(2, files.count());
        }
    }

    @Test
    @DisplayName("A case id that climbs out of the output directory is refused before anything is written")
    void caseIdCannotEscapeOutputDirectory() throws IOException {
        Path root = Files.createDirectory(outputDir.resolve("out"));
        CaseResult valid = result();
        CaseConfig escaping = CaseConfig.builder()
                .caseId("../escaped")
                .person(valid.getConfig().getPerson())
                .occupation(valid.getConfig().getOccupation())
                .assumptions(valid.getConfig().getAssumptions())
                .build();
        CaseResult result = new CaseResult(escaping, valid.getAgeAtEvaluation(), valid.getLifeExpectancy(),
                valid.getWorkLife(), valid.getGrowthSchedule(), valid.getEarnings(), valid.getDiscountFactors(),
                valid.getPresentValue(), valid.getAuditEntries());

        CaseOutputWriter writer = writer(root);
        assertThrows(CaseFileException.class, () -> writer.write(result));
        assertFalse(Files.exists(outputDir.resolve("escaped")));
        assertThrows(CaseFileException.class, () -> writer.caseDirectory(root.toAbsolutePath().resolve("..").toString()));
        assertThrows(CaseFileException.class, () -> writer.caseDirectory("."));
        assertEquals(root.resolve("case_001"), writer.caseDirectory("case_001"));
    }

    @Test
    @DisplayName("An output directory that cannot be created fails with the case directory in the message")
    void unwritableDirectory() throws IOException {
        Path blocker = Files.writeString(outputDir.resolve("blocker"), "not a directory");

        CaseFileException e = assertThrows(CaseFileException.class, () -> writer(blocker).write(result()));
        assertThat(e.getMessage()).contains("case_001");
        assertThat(e.getCause()).isInstanceOf(IOException.class);
    }
}
