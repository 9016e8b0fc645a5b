package com.challenges.kubesql.query;

/**
 * Hyphens are not valid in SQL identifiers, so the raw query has every {@code -}
 * replaced with {@code _} before parsing and extracted names get the reverse.
 * A literal underscore in the query therefore comes back as a hyphen.
 */
public final class HyphenEscaping {
    private HyphenEscaping() {
    }

    public static String escape(String sql) {
        return sql.replace('-', '_');
    }

    public static String unescape(String value) {
        return value.replace('_', '-');
    }
}
