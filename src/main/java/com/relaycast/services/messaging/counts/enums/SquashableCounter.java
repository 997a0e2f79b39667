package com.relaycast.services.messaging.counts.enums;

import java.util.List;

/**
 * Tables of append-only count deltas, with the columns each total is kept over.
 */
public enum SquashableCounter {
    BROADCAST_MSG_COUNTS("broadcast_msg_counts", List.of("broadcast_id")),
    SYSTEM_LABEL_COUNTS("system_label_counts", List.of("org_id", "label_type")),
    CONTACT_GROUP_COUNTS("contact_group_counts", List.of("group_id"));

    private final String table;
    private final List<String> keyColumns;

    SquashableCounter(String table, List<String> keyColumns) {
        this.table = table;
        this.keyColumns = keyColumns;
    }

    public String getTable() {
        return table;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    String keyPredicate() {
        return String.join(" = ? AND ", keyColumns) + " = ?";
    }

    public String unsquashedKeysSql() {
        return "SELECT DISTINCT " + String.join(", ", keyColumns) + " FROM " + table
                + " WHERE is_squashed = FALSE LIMIT ?";
    }

    public String lockingSumSql() {
        return "SELECT COALESCE(SUM(count), 0) FROM " + table + " WHERE " + keyPredicate() + " FOR UPDATE";
    }

    public String deleteSql() {
        return "DELETE FROM " + table + " WHERE " + keyPredicate();
    }

    public String insertSquashedSql() {
        return "INSERT INTO " + table + " (" + String.join(", ", keyColumns) + ", count, is_squashed) VALUES ("
                + "?, ".repeat(keyColumns.size()) + "?, TRUE)";
    }
}
