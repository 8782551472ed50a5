package com.di.silverline.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Files of the same partition do not share a schema. The message names the reference file and
 * every file that disagrees with it.
 */
public class SchemaConflictException extends IngestionException {

    private final String referenceFile;
    private final Map<String, String> conflicts;

    public SchemaConflictException(String tableName, String referenceFile, Map<String, String> conflicts) {
        super(ErrorKind.SCHEMA_CONFLICT, format(tableName, referenceFile, conflicts));
        this.referenceFile = referenceFile;
        this.conflicts = Collections.unmodifiableMap(new LinkedHashMap<>(conflicts));
    }

    public String getReferenceFile() {
        return referenceFile;
    }

    /** Conflicting file URI to a short description of the mismatch. */
    public Map<String, String> getConflicts() {
        return conflicts;
    }

    public List<String> getConflictingFiles() {
        return List.copyOf(conflicts.keySet());
    }

    private static String format(String tableName, String referenceFile, Map<String, String> conflicts) {
        String detail = conflicts.entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        return String.format("Schema conflict in partition of '%s': files [%s] disagree with %s",
                tableName, detail, referenceFile);
    }
}
