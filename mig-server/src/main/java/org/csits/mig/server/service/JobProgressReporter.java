package org.csits.mig.server.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.dao.JobRunEntity;
import org.csits.mig.dao.JobRunRepository;
import org.csits.mig.server.constants.PhaseType;

/**
 * 单次作业运行的进度上报对象，每个加载器处理完一批后调用 {@link #rowsProcessed}。
 */
@Slf4j
public class JobProgressReporter {

    private final JobRunRepository jobRunRepository;

    private final Long jobRunId;

    private final String jobName;

    private final Map<String, Long> perLoader = new LinkedHashMap<>();

    private long rowsProcessed;

    public JobProgressReporter(JobRunRepository jobRunRepository, Long jobRunId, String jobName) {
        this.jobRunRepository = jobRunRepository;
        this.jobRunId = jobRunId;
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }

    public void phaseStarted(PhaseType phase) {
        log.info("阶段开始: job={}, phase={}", jobName, phase);
        updateEntity(entity -> entity.setCurrentPhase(phase.name()));
    }

    public void rowsProcessed(String loaderName, int count) {
        rowsProcessed += count;
        perLoader.merge(loaderName, (long) count, Long::sum);
        log.debug("加载进度: job={}, loader={}, rows={}, total={}", jobName, loaderName, count, rowsProcessed);
        updateEntity(entity -> entity.setRowsProcessed(rowsProcessed));
    }

    public long getRowsProcessed() {
        return rowsProcessed;
    }

    public long getRowsProcessed(String loaderName) {
        return perLoader.getOrDefault(loaderName, 0L);
    }

    private void updateEntity(Consumer<JobRunEntity> change) {
        if (jobRunRepository == null || jobRunId == null) {
            return;
        }
        jobRunRepository.findById(jobRunId).ifPresent(entity -> {
            change.accept(entity);
            jobRunRepository.save(entity);
        });
    }
}
