package com.di.silverline.locate;

import com.di.silverline.config.SilverlineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds the bronze files for a (table, logical date).
 *
 * <p>Only objects ending with the configured suffix count (case-insensitive). Files are ordered by
 * creation time, oldest first, then by name; this is the arrival order later used to break
 * ordering-column ties. Listing is read-only and repeatable.
 */
@Slf4j
@Component
public class PartitionLocator {

    private static final Comparator<BronzeObject> ARRIVAL_ORDER = Comparator
            .comparing(BronzeObject::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(BronzeObject::name);

    private final BronzeStore store;
    private final PartitionPathLayout layout;
    private final String fileSuffix;

    @Autowired
    public PartitionLocator(BronzeStore store, SilverlineProperties properties) {
        this(store, new PartitionPathLayout(properties.getBronzeRoot(), properties.getSourceDatabase()),
                properties.getFileSuffix());
    }

    public PartitionLocator(BronzeStore store, PartitionPathLayout layout, String fileSuffix) {
        this.store = store;
        this.layout = layout;
        this.fileSuffix = fileSuffix == null ? "" : fileSuffix.toLowerCase(Locale.ROOT);
    }

    public PartitionRef locate(String tableName, LocalDate logicalDate) {
        String prefix = layout.prefix(tableName, logicalDate);
        List<BronzeObject> files = store.list(prefix).stream()
                .filter(o -> o.name().toLowerCase(Locale.ROOT).endsWith(fileSuffix))
                .sorted(ARRIVAL_ORDER)
                .toList();
        if (files.isEmpty()) {
            log.info("[LOCATE] {} {}: no files under {}", tableName, logicalDate, prefix);
        } else {
            log.info("[LOCATE] {} {}: {} file(s), {} bytes", tableName, logicalDate, files.size(),
                    files.stream().mapToLong(BronzeObject::sizeBytes).sum());
        }
        return new PartitionRef(tableName, logicalDate, prefix, files);
    }
}
