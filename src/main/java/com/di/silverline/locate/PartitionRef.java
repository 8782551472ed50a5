package com.di.silverline.locate;

import java.time.LocalDate;
import java.util.List;

/**
 * The data files of one table for one logical date, in arrival order.
 * An empty file list is a normal outcome (nothing arrived that day).
 */
public record PartitionRef(String tableName, LocalDate logicalDate, String prefix, List<BronzeObject> files) {

    public PartitionRef {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public List<String> uris() {
        return files.stream().map(BronzeObject::uri).toList();
    }
}
