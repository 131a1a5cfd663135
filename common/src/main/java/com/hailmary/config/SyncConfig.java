package com.hailmary.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level sync configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code hailmary.*} prefix.
 * {@link #loadFromClasspath(String)} reads the same tree outside the Spring context.</p>
 */
@Data
@ConfigurationProperties(prefix = "hailmary")
public class SyncConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private CheckpointConfig checkpoint = new CheckpointConfig();
    private RetryConfig retry = new RetryConfig();
    private RefreshConfig refresh = new RefreshConfig();
    private List<SourceConfig> sources = new ArrayList<>();

    /** Start polling as soon as the application is ready. */
    private boolean autoStart = true;

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a classpath resource.
     */
    public static SyncConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = SyncConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, SyncConfig.class);
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public List<SourceConfig> getEnabledSources() {
        return sources.stream().filter(SourceConfig::isEnabled).toList();
    }

    public Optional<SourceConfig> findSource(String name) {
        return sources.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    /**
     * Rejects configurations that could corrupt the index: missing identifiers,
     * duplicate source names, or two sources sharing one destination index.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validate() {
        Map<String, String> indexOwners = new HashMap<>();
        Map<String, SourceConfig> byName = new HashMap<>();
        for (SourceConfig source : sources) {
            requireText(source.getName(), "sources[].name");
            requireText(source.getRelation(), "sources[" + source.getName() + "].relation");
            if (source.getPrimaryKey() == null || source.getPrimaryKey().isEmpty()) {
                throw new IllegalStateException("sources[" + source.getName() + "].primaryKey is not configured");
            }
            for (String keyColumn : source.getPrimaryKey()) {
                requireText(keyColumn, "sources[" + source.getName() + "].primaryKey[]");
            }
            requireText(source.getTrackingColumn(), "sources[" + source.getName() + "].trackingColumn");
            requireText(source.getIndex(), "sources[" + source.getName() + "].index");
            if (source.getBatchSize() <= 0) {
                throw new IllegalStateException("sources[" + source.getName() + "].batchSize must be positive");
            }
            if (byName.put(source.getName(), source) != null) {
                throw new IllegalStateException("Duplicate source name: " + source.getName());
            }
            String owner = indexOwners.putIfAbsent(source.getIndex(), source.getName());
            if (owner != null) {
                throw new IllegalStateException("Index '" + source.getIndex() + "' is targeted by both '"
                        + owner + "' and '" + source.getName() + "'; every source needs its own index");
            }
        }
    }

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " is not configured");
        }
    }
}
