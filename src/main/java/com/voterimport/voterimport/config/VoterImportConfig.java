package com.voterimport.voterimport.config;

import com.voterimport.voterimport.dedup.Deduplicator;
import com.voterimport.voterimport.ingest.ImportPipeline;
import com.voterimport.voterimport.normalize.FieldNormalizer;
import com.voterimport.voterimport.schema.AliasCatalog;
import com.voterimport.voterimport.schema.SchemaDetector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables binding of {@link VoterImportProperties} and wires the detection and import components from them.
 */
@Configuration
@EnableConfigurationProperties(VoterImportProperties.class)
public class VoterImportConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AliasCatalog aliasCatalog() {
        return AliasCatalog.standard();
    }

    @Bean
    public SchemaDetector schemaDetector(AliasCatalog aliasCatalog, VoterImportProperties properties) {
        return new SchemaDetector(aliasCatalog, properties.getMinConfidence(), properties.getSampleSize());
    }

    @Bean
    public ConfigBuilder configBuilder(SchemaDetector schemaDetector, Clock clock) {
        return new ConfigBuilder(schemaDetector, clock);
    }

    @Bean
    public FieldNormalizer fieldNormalizer() {
        return new FieldNormalizer();
    }

    @Bean
    public Deduplicator deduplicator() {
        return new Deduplicator();
    }

    @Bean
    public ImportPipeline importPipeline(FieldNormalizer fieldNormalizer, Deduplicator deduplicator,
                                         VoterImportProperties properties) {
        return new ImportPipeline(fieldNormalizer, deduplicator,
                properties.getMaxRecordedErrors(), properties.getSinkRetryAttempts());
    }
}
