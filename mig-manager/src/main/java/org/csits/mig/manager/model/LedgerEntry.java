package org.csits.mig.manager.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 账本条目：加载器产生副作用时记录的扁平键值，始终包含产生它的行唯一标识 {@value #UID}。
 */
@ToString
@EqualsAndHashCode
public final class LedgerEntry {

    public static final String UID = "uid";

    private final Map<String, Object> values;

    private LedgerEntry(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static LedgerEntry of(String uid, Map<String, ?> fields) {
        if (uid == null || uid.isEmpty()) {
            throw new IllegalArgumentException("账本条目缺少 uid");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        copy.put(UID, uid);
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (!UID.equals(k)) {
                    copy.put(k, v);
                }
            });
        }
        return new LedgerEntry(copy);
    }

    /**
     * 从持久化的扁平记录恢复条目，记录必须含 uid。
     */
    public static LedgerEntry fromMap(Map<String, ?> record) {
        Object uid = record.get(UID);
        if (uid == null) {
            throw new IllegalArgumentException("账本记录缺少 uid: " + record);
        }
        return of(uid.toString(), record);
    }

    public String getUid() {
        return (String) values.get(UID);
    }

    public Object get(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Set<String> fieldNames() {
        return values.keySet();
    }

    public Map<String, Object> toMap() {
        return values;
    }
}
