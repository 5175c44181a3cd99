package com.gillianbc.forensicloss.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.forensicloss.exception.CaseFileException;
import com.gillianbc.forensicloss.exception.ForensicLossException;
import com.gillianbc.forensicloss.model.CaseConfig;
import com.gillianbc.forensicloss.model.CaseResult;
import com.gillianbc.forensicloss.report.CaseOutputWriter;
import com.gillianbc.forensicloss.service.ForensicLossService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every case configuration file named on the command line. Option arguments
 * ({@code --key=value}) are left to Spring.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseFileRunner implements CommandLineRunner {

    private final ObjectMapper objectMapper;
    private final ForensicLossService lossService;
    private final CaseOutputWriter outputWriter;

    @Override
    public void run(String... args) {
        List<Path> caseFiles = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                caseFiles.add(Paths.get(arg));
            }
        }
        if (caseFiles.isEmpty()) {
            log.info("No case files given. Usage: java -jar forensic-loss.jar <case_config.json>...");
            return;
        }
        for (Path caseFile : caseFiles) {
            runCase(caseFile);
        }
    }

    public CaseResult runCase(Path caseFile) {
        CaseConfig config = readConfig(caseFile);
        CaseResult result;
        try {
            result = lossService.run(config);
        } catch (ForensicLossException e) {
            log.error("Case file {} failed at stage {}: {}", caseFile.toAbsolutePath(), e.getStage().getLabel(),
                    e.getMessage());
            throw e;
        }
        outputWriter.write(result);
        return result;
    }

    CaseConfig readConfig(Path caseFile) {
        try {
            return objectMapper.readValue(Files.readAllBytes(caseFile), CaseConfig.class);
        } catch (IOException e) {
            log.error("Failed to read case configuration {}", caseFile.toAbsolutePath(), e);
            throw new CaseFileException("Failed to read case configuration " + caseFile, e);
        }
    }
}
