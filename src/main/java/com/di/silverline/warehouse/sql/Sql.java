package com.di.silverline.warehouse.sql;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Rendering helpers shared by the statement types.
 */
final class Sql {

    private Sql() {
    }

    static String ident(String name) {
        if (name.indexOf('`') >= 0) {
            throw new IllegalArgumentException("Illegal identifier: " + name);
        }
        return "`" + name + "`";
    }

    static String qualified(String alias, String column) {
        return alias + "." + ident(column);
    }

    static String identList(Collection<String> names) {
        return names.stream().map(Sql::ident).collect(Collectors.joining(", "));
    }

    static String qualifiedList(String alias, Collection<String> names) {
        return names.stream().map(n -> qualified(alias, n)).collect(Collectors.joining(", "));
    }

    static String dateLiteral(LocalDate date) {
        return "DATE '" + date.format(DateTimeFormatter.ISO_LOCAL_DATE) + "'";
    }
}
