package org.csits.mig.server.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

/**
 * 抽取/转换步骤配置。name 与 type 之外的键作为适配器参数保存在 options 中。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepConfig {

    private String name;

    /**
     * 适配器类型标签，例如 json、select_prefix。
     */
    private String type;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> options = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOption(String key, Object value) {
        options.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOptions() {
        return options;
    }

    public Object getOption(String key) {
        return options.get(key);
    }

    public String getString(String key) {
        Object value = options.get(key);
        return value == null ? null : value.toString();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * 取字符串列表，单个标量视为只含一项的列表。
     */
    public List<String> getStringList(String key) {
        Object value = options.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item));
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }

    public Map<String, String> getStringMap(String key) {
        Object value = options.get(key);
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), v == null ? null : v.toString()));
        }
        return result;
    }
}
