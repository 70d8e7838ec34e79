package org.csits.mig.manager.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 账本结构声明，用于带类型的持久化：字段按声明顺序输出，值按声明类型转换。
 */
public final class LedgerSchema {

    public enum FieldType {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        LIST
    }

    private final Map<String, FieldType> fields;

    private LedgerSchema(Map<String, FieldType> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * 由配置创建，类型名不区分大小写，例如 {post_id: integer, title: string}。
     */
    public static LedgerSchema of(Map<String, String> declared) {
        Map<String, FieldType> parsed = new LinkedHashMap<>();
        declared.forEach((name, type) -> {
            try {
                parsed.put(name, FieldType.valueOf(type.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("账本字段 " + name + " 的类型不受支持: " + type, e);
            }
        });
        return new LedgerSchema(parsed);
    }

    public Map<String, FieldType> getFields() {
        return fields;
    }

    /**
     * 按结构输出条目：uid 在前，随后为声明字段（缺失为 null），未声明字段保留在末尾。
     */
    public Map<String, Object> apply(LedgerEntry entry) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(LedgerEntry.UID, entry.getUid());
        fields.forEach((name, type) -> result.put(name, coerce(name, type, entry.get(name))));
        entry.toMap().forEach(result::putIfAbsent);
        return result;
    }

    static Object coerce(String name, FieldType type, Object value) {
        if (value == null) {
            return null;
        }
        try {
            switch (type) {
                case STRING:
                    return value.toString();
                case INTEGER:
                    if (value instanceof Number) {
                        return ((Number) value).longValue();
                    }
                    return Long.parseLong(value.toString().trim());
                case FLOAT:
                    if (value instanceof Number) {
                        return ((Number) value).doubleValue();
                    }
                    return Double.parseDouble(value.toString().trim());
                case BOOLEAN:
                    if (value instanceof Boolean) {
                        return value;
                    }
                    return Boolean.parseBoolean(value.toString().trim());
                case LIST:
                    if (value instanceof Collection) {
                        return new ArrayList<>((Collection<?>) value);
                    }
                    List<Object> single = new ArrayList<>();
                    single.add(value);
                    return single;
                default:
                    return value;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("账本字段 " + name + " 无法转换为 " + type + ": " + value, e);
        }
    }
}
