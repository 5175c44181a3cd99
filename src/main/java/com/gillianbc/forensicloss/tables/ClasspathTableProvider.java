package com.gillianbc.forensicloss.tables;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.forensicloss.exception.TableLookupException;
import com.gillianbc.forensicloss.model.PipelineStage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads bundled JSON tables named {@code <location>/<kind>.json} from the classpath.
 */
@Slf4j
public class ClasspathTableProvider implements ReferenceTableProvider {

    private final ObjectMapper objectMapper;
    private final String location;
    private final ClassLoader classLoader;

    public ClasspathTableProvider(ObjectMapper objectMapper, String location) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        String trimmed = Objects.requireNonNull(location, "location must not be null");
        if (trimmed.startsWith("classpath:")) {
            trimmed = trimmed.substring("classpath:".length());
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        this.location = trimmed.endsWith("/") || trimmed.isEmpty() ? trimmed : trimmed + "/";
        this.classLoader = ClasspathTableProvider.class.getClassLoader();
    }

    @Override
    public TableDocument load(TableKind kind) {
        String resource = location + kind.getResourceName() + ".json";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new TableLookupException(PipelineStage.REFERENCE_TABLES, kind.getResourceName(),
                        "classpath resource " + resource);
            }
            TableDocument document = objectMapper.readValue(in, TableDocument.class);
            log.debug("Loaded {} rows from {}", document.getRows().size(), resource);
            return document;
        } catch (IOException e) {
            throw new TableLookupException(PipelineStage.REFERENCE_TABLES, kind.getResourceName(),
                    "classpath resource " + resource, e);
        }
    }
}
