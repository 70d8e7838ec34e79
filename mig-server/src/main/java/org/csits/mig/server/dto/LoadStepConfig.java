package org.csits.mig.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 加载步骤配置，额外带目标实体类型与账本声明。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadStepConfig extends StepConfig {

    /**
     * 目标实体类型，例如 post、term。
     */
    @JsonProperty("destination_type")
    private String destinationType;

    /**
     * 为空表示该加载器不记录账本。
     */
    private LoaderLedgerConfig ledger;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoaderLedgerConfig {

        private boolean primary;

        /**
         * 字段名 -> 类型（string/integer/float/boolean/list），声明后按结构持久化。
         */
        private Map<String, String> schema = new LinkedHashMap<>();
    }
}
