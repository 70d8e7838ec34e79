package org.csits.mig.server.dto;

import lombok.Data;
import org.csits.mig.server.service.JobProgressReporter;
import org.csits.mig.server.service.LedgerRegistry;

/**
 * 作业运行上下文，在阶段处理器与适配器之间贯穿一次作业运行。
 */
@Data
public class JobRunContext {

    /**
     * 作业运行记录 ID。
     */
    private Long jobRunId;

    /**
     * 运行标识，同时作为账本与输出文件名的时间戳。
     */
    private String runId;

    private JobConfig jobConfig;

    private MigrationConfig.Settings settings;

    private JobProgressReporter reporter;

    /**
     * 依赖作业账本的读取入口，供 ledger 抽取器与 ledger_lookup 转换器使用。
     */
    private LedgerRegistry ledgerRegistry;

    public JobRunContext() {
    }

    public JobRunContext(Long jobRunId, String runId, JobConfig jobConfig,
                         MigrationConfig.Settings settings, JobProgressReporter reporter,
                         LedgerRegistry ledgerRegistry) {
        this.jobRunId = jobRunId;
        this.runId = runId;
        this.jobConfig = jobConfig;
        this.settings = settings;
        this.reporter = reporter;
        this.ledgerRegistry = ledgerRegistry;
    }

    public String getJobName() {
        return jobConfig == null ? null : jobConfig.getName();
    }

    public int getBatchSize() {
        if (jobConfig != null && jobConfig.getBatchSize() != null && jobConfig.getBatchSize() > 0) {
            return jobConfig.getBatchSize();
        }
        if (settings != null && settings.getBatchSize() != null && settings.getBatchSize() > 0) {
            return settings.getBatchSize();
        }
        return 500;
    }

    public boolean isReclaimMemory() {
        return settings == null || settings.getReclaimMemory() == null || settings.getReclaimMemory();
    }
}
