package org.csits.mig.server.service;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.dao.JobRunEntity;
import org.csits.mig.dao.JobRunRepository;
import org.csits.mig.dao.JobRunStatus;
import org.springframework.stereotype.Service;

/**
 * 作业运行状态机
 * BUILT -> EXTRACT_RUNNING -> TRANSFORM_RUNNING -> LOAD_RUNNING -> DONE，任一非终态可转为 FAILED。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStateMachine {

    private static final Map<JobRunStatus, Set<JobRunStatus>> TRANSITIONS = new EnumMap<>(JobRunStatus.class);

    static {
        // 单阶段运行可从 BUILT 直接进入任一阶段，阶段只能向前推进
        TRANSITIONS.put(JobRunStatus.BUILT, EnumSet.of(
            JobRunStatus.EXTRACT_RUNNING, JobRunStatus.TRANSFORM_RUNNING,
            JobRunStatus.LOAD_RUNNING, JobRunStatus.FAILED));
        TRANSITIONS.put(JobRunStatus.EXTRACT_RUNNING, EnumSet.of(
            JobRunStatus.TRANSFORM_RUNNING, JobRunStatus.LOAD_RUNNING, JobRunStatus.FAILED));
        TRANSITIONS.put(JobRunStatus.TRANSFORM_RUNNING, EnumSet.of(
            JobRunStatus.LOAD_RUNNING, JobRunStatus.FAILED));
        TRANSITIONS.put(JobRunStatus.LOAD_RUNNING, EnumSet.of(
            JobRunStatus.DONE, JobRunStatus.FAILED));
        TRANSITIONS.put(JobRunStatus.DONE, EnumSet.noneOf(JobRunStatus.class));
        TRANSITIONS.put(JobRunStatus.FAILED, EnumSet.noneOf(JobRunStatus.class));
    }

    private final JobRunRepository jobRunRepository;

    /**
     * 新建运行记录，初始状态 BUILT。
     */
    public JobRunEntity create(String jobName, String runId) {
        JobRunEntity entity = new JobRunEntity();
        entity.setJobName(jobName);
        entity.setRunId(runId);
        entity.setStatus(JobRunStatus.BUILT);
        JobRunEntity saved = jobRunRepository.save(entity);
        log.debug("创建作业运行记录: id={}, job={}, runId={}", saved.getId(), jobName, runId);
        return saved;
    }

    /**
     * 转换运行状态
     *
     * @param jobRunId 运行记录ID
     * @param target 目标状态
     * @param phase 当前阶段名，为 null 时不修改
     * @return 是否转换成功
     */
    public boolean transitionTo(Long jobRunId, JobRunStatus target, String phase) {
        JobRunEntity entity = jobRunRepository.findById(jobRunId).orElse(null);
        if (entity == null) {
            log.error("作业运行记录不存在: id={}", jobRunId);
            return false;
        }
        JobRunStatus current = entity.getStatus();
        if (current == target) {
            log.debug("已是目标状态，跳过转换: id={}, status={}", jobRunId, current);
            return true;
        }
        if (!isValidTransition(current, target)) {
            log.error("非法的状态转换: id={}, job={}, from={}, to={}",
                jobRunId, entity.getJobName(), current, target);
            return false;
        }
        entity.setStatus(target);
        if (phase != null) {
            entity.setCurrentPhase(phase);
        }
        if (target.isTerminal()) {
            entity.setEndTime(LocalDateTime.now());
        }
        jobRunRepository.save(entity);
        log.info("作业状态转换: job={}, {} -> {}", entity.getJobName(), current, target);
        return true;
    }

    public boolean markDone(Long jobRunId) {
        return transitionTo(jobRunId, JobRunStatus.DONE, null);
    }

    public boolean markFailed(Long jobRunId, String errorMessage) {
        JobRunEntity entity = jobRunRepository.findById(jobRunId).orElse(null);
        if (entity != null) {
            entity.setErrorMessage(errorMessage);
            jobRunRepository.save(entity);
        }
        return transitionTo(jobRunId, JobRunStatus.FAILED, null);
    }

    public JobRunStatus getCurrentStatus(Long jobRunId) {
        return jobRunRepository.findById(jobRunId)
            .map(JobRunEntity::getStatus)
            .orElse(null);
    }

    boolean isValidTransition(JobRunStatus from, JobRunStatus to) {
        if (from == null) {
            return to == JobRunStatus.BUILT;
        }
        return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(JobRunStatus.class)).contains(to);
    }
}
