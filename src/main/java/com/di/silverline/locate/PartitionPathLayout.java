package com.di.silverline.locate;

import java.time.LocalDate;

/**
 * Hive-style bronze layout: {@code <root>/<source_db>/<table>/year=YYYY/month=MM/day=DD/}.
 * Month and day are zero-padded.
 */
public final class PartitionPathLayout {

    private final String root;
    private final String sourceDatabase;

    public PartitionPathLayout(String root, String sourceDatabase) {
        this.root = trimSlashes(root);
        this.sourceDatabase = trimSlashes(sourceDatabase);
    }

    public String prefix(String tableName, LocalDate date) {
        StringBuilder sb = new StringBuilder();
        if (!root.isEmpty()) {
            sb.append(root).append('/');
        }
        if (!sourceDatabase.isEmpty()) {
            sb.append(sourceDatabase).append('/');
        }
        return sb.append(tableName).append('/')
                .append(String.format("year=%04d/month=%02d/day=%02d/",
                        date.getYear(), date.getMonthValue(), date.getDayOfMonth()))
                .toString();
    }

    private static String trimSlashes(String s) {
        if (s == null) {
            return "";
        }
        String out = s.trim();
        while (out.startsWith("/")) {
            out = out.substring(1);
        }
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
