package org.csits.mig.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 单个作业配置，对应 migration 列表中的一项。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobConfig {

    private String name;

    private String description;

    @JsonProperty("depends_on")
    private List<String> dependsOn = new ArrayList<>();

    private boolean skip;

    private List<StepConfig> extract = new ArrayList<>();

    private List<StepConfig> transform = new ArrayList<>();

    private List<LoadStepConfig> load = new ArrayList<>();

    private JobLedgerConfig ledger = new JobLedgerConfig();

    /**
     * 作业的主要目标实体类型，多个账本时用于挑选主账本。
     */
    @JsonProperty("principal_entity")
    private String principalEntity;

    /**
     * 覆盖全局 settings.batch_size。
     */
    @JsonProperty("batch_size")
    private Integer batchSize;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobLedgerConfig {

        /**
         * 账本子目录，相对全局 ledger.path；为空时直接写在根目录。
         */
        private String path;
    }
}
