package org.csits.mig.server.service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.dao.JobRunStatus;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.PipelineState;
import org.csits.mig.server.exception.FatalMigrationException;
import org.csits.mig.server.exception.JobExecutionException;
import org.csits.mig.server.worker.core.PhaseProcessor;
import org.csits.mig.server.worker.core.PhaseProcessorFactory;

/**
 * 单个作业的阶段编排：抽取 -> 转换 -> 加载，状态在阶段之间传递。
 *
 * <p>每个阶段前加载依赖作业的账本，阶段结束后卸载。只执行单个阶段时作业停留在该阶段的运行状态，
 * 加载阶段除外，加载完成即 DONE。
 */
@Slf4j
public class PipelineJob {

    private final JobRunContext context;
    private final JobStateMachine stateMachine;
    private final LedgerRegistry ledgerRegistry;
    private final PhaseProcessorFactory processorFactory;

    private final Map<PhaseType, PhaseProcessor> processors = new EnumMap<>(PhaseType.class);

    private PipelineState state = PipelineState.initial();

    public PipelineJob(JobRunContext context, JobStateMachine stateMachine, LedgerRegistry ledgerRegistry,
                       PhaseProcessorFactory processorFactory) {
        this.context = context;
        this.stateMachine = stateMachine;
        this.ledgerRegistry = ledgerRegistry;
        this.processorFactory = processorFactory;
    }

    public String getName() {
        return context.getJobName();
    }

    public JobConfig getConfig() {
        return context.getJobConfig();
    }

    public JobRunContext getContext() {
        return context;
    }

    public PipelineState getState() {
        return state;
    }

    public JobRunStatus getStatus() {
        return stateMachine.getCurrentStatus(context.getJobRunId());
    }

    /**
     * 为每个阶段创建处理器。适配器构造失败视为作业失败。
     */
    public PipelineJob build() {
        try {
            for (PhaseType phase : PhaseType.values()) {
                processors.put(phase, processorFactory.create(phase, context));
            }
        } catch (FatalMigrationException e) {
            stateMachine.markFailed(context.getJobRunId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            stateMachine.markFailed(context.getJobRunId(), e.getMessage());
            throw new JobExecutionException(getName(), null, e);
        }
        log.debug("作业已构建: job={}, runId={}", getName(), context.getRunId());
        return this;
    }

    /**
     * 依次执行全部阶段。
     */
    public PipelineState process() {
        for (PhaseType phase : PhaseType.values()) {
            runPhase(phase);
        }
        stateMachine.markDone(context.getJobRunId());
        return state;
    }

    /**
     * 只执行一个阶段。
     */
    public PipelineState process(PhaseType phase) {
        runPhase(phase);
        if (phase == PhaseType.LOAD) {
            stateMachine.markDone(context.getJobRunId());
        }
        return state;
    }

    private void runPhase(PhaseType phase) {
        PhaseProcessor processor = processors.get(phase);
        if (processor == null) {
            throw new IllegalStateException("作业尚未构建: " + getName());
        }
        stateMachine.transitionTo(context.getJobRunId(), phase.getRunningStatus(), phase.name());
        if (context.getReporter() != null) {
            context.getReporter().phaseStarted(phase);
        }
        List<String> dependencies = getConfig().getDependsOn();
        loadDependencies(dependencies);
        try {
            state = processor.process(state);
        } catch (FatalMigrationException e) {
            stateMachine.markFailed(context.getJobRunId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            stateMachine.markFailed(context.getJobRunId(), e.getMessage());
            throw new JobExecutionException(getName(), phase, e);
        } finally {
            unloadDependencies(dependencies);
        }
    }

    private void loadDependencies(List<String> dependencies) {
        for (String dependency : dependencies) {
            if (!ledgerRegistry.get(dependency).isPresent()) {
                log.warn("依赖作业账本不可用: job={}, dependency={}", getName(), dependency);
            }
        }
    }

    private void unloadDependencies(List<String> dependencies) {
        for (String dependency : dependencies) {
            ledgerRegistry.unload(dependency);
        }
    }
}
