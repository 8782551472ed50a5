package com.di.silverline.config;

import com.di.silverline.exception.InvalidStrategyException;
import com.di.silverline.strategy.StrategyDescriptor;
import com.di.silverline.strategy.StrategyKind;
import com.di.silverline.strategy.StrategyRegistry;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the per-table strategy YAML into a validated {@link StrategyRegistry}.
 *
 * <pre>
 * table_strategies:
 *   alm_his_1:
 *     strategy: incremental_merge
 *     pk: [id]
 *     event_ts: f_fecha
 *     cluster_by: [id]
 *   alm_pie_1:
 *     strategy: replace_partition
 *     partition_field: snapshot_date
 * </pre>
 *
 * A missing or unreadable file is fatal, as is any invalid entry: the exception lists every offending table.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;
    private final SilverlineProperties properties;

    public StrategyRegistry load() {
        String location = properties.getStrategiesFile();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Strategy file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            log.info("[REGISTRY] Loading table strategies from {}", location);
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read strategy file " + location, e);
        }
    }

    /**
     * Parses and validates a strategy document.
     *
     * @throws InvalidStrategyException naming every invalid table
     */
    public static StrategyRegistry parse(InputStream in) throws IOException {
        StrategyConfigFile file = YAML_MAPPER.readValue(in, StrategyConfigFile.class);
        StrategyRegistry.Builder builder = StrategyRegistry.builder();
        if (file == null || file.getTableStrategies() == null) {
            log.warn("[REGISTRY] Strategy file has no table_strategies section");
            return builder.build();
        }
        for (Map.Entry<String, TableStrategyConfig> e : file.getTableStrategies().entrySet()) {
            String table = e.getKey().trim();
            TableStrategyConfig cfg = e.getValue();
            if (cfg == null) {
                builder.reject(table, "entry is empty");
                continue;
            }
            Optional<StrategyKind> kind = StrategyKind.fromConfigKey(cfg.getStrategy());
            if (kind.isEmpty()) {
                builder.reject(table, "unknown strategy '" + cfg.getStrategy() + "'");
                continue;
            }
            builder.add(new StrategyDescriptor(table, kind.get(), cfg.getKeyColumns(), cfg.getOrderingColumn(),
                    cfg.getPartitionField(), cfg.getClusterColumns()));
        }
        return builder.build();
    }
}
