package com.gillianbc.forensicloss.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.forensicloss.tables.ClasspathTableProvider;
import com.gillianbc.forensicloss.tables.ReferenceTableProvider;
import com.gillianbc.forensicloss.tables.ReferenceTables;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the reference tables once per process. The resulting bean is immutable and shared
 * by every case run.
 */
@Configuration
public class ReferenceTablesConfig {

    @Bean
    public ReferenceTableProvider referenceTableProvider(ObjectMapper objectMapper, ForensicLossProperties properties) {
        return new ClasspathTableProvider(objectMapper, properties.getTablesLocation());
    }

    @Bean
    public ReferenceTables referenceTables(ReferenceTableProvider referenceTableProvider) {
        return ReferenceTables.load(referenceTableProvider);
    }
}
