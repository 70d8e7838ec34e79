package org.csits.mig.manager.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 行：有序的字段名到值映射，始终携带唯一标识字段 {@value #UID}。
 * 行是值语义的，任何修改都返回新实例，不会影响已持有旧实例的读者。
 */
@ToString
@EqualsAndHashCode
public final class Row {

    /**
     * 行唯一标识字段名。
     */
    public static final String UID = "etl.uid";

    private final Map<String, Object> entries;

    private Row(Map<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * 由字段映射创建行，缺少唯一标识时自动生成。
     */
    public static Row of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            copy.putAll(values);
        }
        Object uid = copy.get(UID);
        if (uid == null || uid.toString().isEmpty()) {
            copy.put(UID, newUid());
        }
        return new Row(copy);
    }

    public static Row of(String uid, Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        copy.put(UID, uid);
        if (values != null) {
            values.forEach((k, v) -> {
                if (!UID.equals(k)) {
                    copy.put(k, v);
                }
            });
        }
        return of(copy);
    }

    public static String newUid() {
        return UUID.randomUUID().toString();
    }

    public String uid() {
        return String.valueOf(entries.get(UID));
    }

    public boolean has(String name) {
        return entries.containsKey(name);
    }

    public Object valueOf(String name) {
        return entries.get(name);
    }

    public Row with(String name, Object value) {
        if (UID.equals(name) && (value == null || value.toString().isEmpty())) {
            throw new IllegalArgumentException("行唯一标识不能为空");
        }
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(name, value);
        return new Row(copy);
    }

    public Row withAll(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        values.forEach((k, v) -> {
            if (!UID.equals(k)) {
                copy.put(k, v);
            }
        });
        return new Row(copy);
    }

    public Row without(String... names) {
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        for (String name : names) {
            if (!UID.equals(name)) {
                copy.remove(name);
            }
        }
        return new Row(copy);
    }

    public Row rename(String from, String to) {
        if (!entries.containsKey(from) || UID.equals(from) || UID.equals(to)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> {
            if (k.equals(from)) {
                copy.put(to, v);
            } else if (!k.equals(to)) {
                copy.put(k, v);
            }
        });
        return new Row(copy);
    }

    /**
     * 取出以 prefix 开头的字段并去掉前缀，例如 prefix=ledger 时 ledger.post_id -> post_id。
     */
    public Map<String, Object> reduceOnPrefix(String prefix) {
        String normalized = prefix.endsWith(".") ? prefix : prefix + ".";
        Map<String, Object> result = new LinkedHashMap<>();
        entries.forEach((k, v) -> {
            if (k.startsWith(normalized) && k.length() > normalized.length()) {
                result.put(k.substring(normalized.length()), v);
            }
        });
        return result;
    }

    public Map<String, Object> toMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }
}
