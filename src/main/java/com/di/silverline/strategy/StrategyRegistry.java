package com.di.silverline.strategy;

import com.di.silverline.exception.InvalidStrategyException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table name to {@link StrategyDescriptor} mapping, validated eagerly when built.
 *
 * <p>A registry either contains only executable descriptors or is never constructed: {@link Builder#build()}
 * throws {@link InvalidStrategyException} naming every bad table, so a configuration error
 * surfaces before any table is processed. Lookup is by exact (trimmed) table name and preserves
 * configuration order.
 */
@Slf4j
public final class StrategyRegistry {

    private final Map<String, StrategyDescriptor> descriptorsByTable;

    private StrategyRegistry(Map<String, StrategyDescriptor> descriptorsByTable) {
        this.descriptorsByTable = Collections.unmodifiableMap(new LinkedHashMap<>(descriptorsByTable));
    }

    public static StrategyRegistry of(Collection<StrategyDescriptor> descriptors) {
        Builder builder = builder();
        descriptors.forEach(builder::add);
        return builder.build();
    }

    public static StrategyRegistry empty() {
        return new StrategyRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the descriptor, or empty when the table is not configured (a deliberate omission,
     *         reported as Skipped by the coordinator)
     */
    public Optional<StrategyDescriptor> resolve(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptorsByTable.get(tableName.trim()));
    }

    public Set<String> tableNames() {
        return descriptorsByTable.keySet();
    }

    public List<StrategyDescriptor> descriptors() {
        return List.copyOf(descriptorsByTable.values());
    }

    public int size() {
        return descriptorsByTable.size();
    }

    public static final class Builder {

        private final Map<String, StrategyDescriptor> descriptors = new LinkedHashMap<>();
        private final Map<String, List<String>> problems = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(StrategyDescriptor descriptor) {
            String table = descriptor.tableName() == null ? "" : descriptor.tableName();
            List<String> errors = descriptor.validationErrors();
            if (!errors.isEmpty()) {
                problems.computeIfAbsent(table, t -> new ArrayList<>()).addAll(errors);
                return this;
            }
            if (descriptors.putIfAbsent(table, descriptor) != null) {
                reject(table, "configured more than once");
            }
            return this;
        }

        /** Records a problem found before a descriptor could be built (e.g. unknown strategy kind). */
        public Builder reject(String tableName, String problem) {
            problems.computeIfAbsent(tableName, t -> new ArrayList<>()).add(problem);
            return this;
        }

        public StrategyRegistry build() {
            if (!problems.isEmpty()) {
                InvalidStrategyException ex = new InvalidStrategyException(problems);
                log.error("[REGISTRY] {}", ex.getMessage());
                throw ex;
            }
            log.info("[REGISTRY] {} table strategies registered: {}", descriptors.size(), descriptors.keySet());
            return new StrategyRegistry(descriptors);
        }
    }
}
