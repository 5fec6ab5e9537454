package com.tablesync.state;

import lombok.Value;

/** Identifies one row: the table it lives in and its primary key. */
@Value
public class EntityKey {

    String table;
    String id;

    public EntityKey(String table, String id) {
        if (table == null || id == null) {
            throw new IllegalArgumentException("EntityKey needs both table and id");
        }
        this.table = table;
        this.id = id;
    }

    public static EntityKey of(String table, Object id) {
        return new EntityKey(table, String.valueOf(id));
    }
}
