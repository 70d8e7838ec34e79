package org.csits.mig.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 迁移定义，对应 migration.yaml：有序作业列表、全局账本目录与运行参数。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MigrationConfig {

    /**
     * 作业按配置顺序执行，依赖必须排在依赖方之前。
     */
    private List<JobConfig> migration = new ArrayList<>();

    private LedgerRootConfig ledger = new LedgerRootConfig();

    private Settings settings = new Settings();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LedgerRootConfig {

        /**
         * 账本根目录，作业的 ledger.path 相对于此目录。
         */
        private String path = "ledgers";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {

        /**
         * 加载阶段每批行数。
         */
        @JsonProperty("batch_size")
        private Integer batchSize = 500;

        /**
         * 每批加载完成后是否请求 GC。
         */
        @JsonProperty("reclaim_memory")
        private Boolean reclaimMemory = Boolean.TRUE;

        /**
         * json 加载器默认输出目录。
         */
        @JsonProperty("output_path")
        private String outputPath = "output";
    }
}
