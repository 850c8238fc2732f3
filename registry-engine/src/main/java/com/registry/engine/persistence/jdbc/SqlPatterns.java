package com.registry.engine.persistence.jdbc;

import java.util.Locale;

/**
 * LIKE/ILIKE pattern helpers.
 */
final class SqlPatterns {

    private SqlPatterns() {
    }

    /**
     * Substring pattern with the LIKE wildcards in the needle escaped (default escape char is backslash).
     */
    static String contains(String needle) {
        String escaped = needle.trim().toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
