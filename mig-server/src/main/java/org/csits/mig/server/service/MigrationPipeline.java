package org.csits.mig.server.service;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.dao.JobRunEntity;
import org.csits.mig.dao.JobRunRepository;
import org.csits.mig.manager.batch.RunTimestampGenerator;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.MigrationConfig;
import org.csits.mig.server.dto.RunOptions;
import org.csits.mig.server.dto.RunSummary;
import org.csits.mig.server.exception.FatalMigrationException;
import org.csits.mig.server.exception.JobExecutionException;
import org.csits.mig.server.exception.JobGraphValidationException;
import org.csits.mig.server.worker.core.PhaseProcessorFactory;
import org.springframework.stereotype.Service;

/**
 * 迁移流水线：校验依赖图，按配置顺序逐个执行选中的作业。
 *
 * <p>依赖图存在任何违规都不会开始执行。单个作业失败只终止该作业，{@link FatalMigrationException} 终止整个运行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationPipeline {

    private final MigrationConfigService migrationConfigService;
    private final JobGraphValidator jobGraphValidator;
    private final JobStateMachine jobStateMachine;
    private final JobRunRepository jobRunRepository;
    private final LedgerRegistry ledgerRegistry;
    private final PhaseProcessorFactory phaseProcessorFactory;
    private final RunTimestampGenerator runTimestampGenerator;

    public JobGraphValidationResult validate() {
        return jobGraphValidator.validate(migrationConfigService.getMigrationConfig().getMigration());
    }

    /**
     * 执行计划：依赖图给出的顺序，再按 --jobs 与 --skip 过滤。
     */
    public List<JobConfig> plan(JobGraphValidationResult validation, RunOptions options) {
        List<JobConfig> plan = new ArrayList<>();
        for (JobConfig job : validation.getExecutionPlan()) {
            if (!options.getJobs().isEmpty() && !options.getJobs().contains(job.getName())) {
                continue;
            }
            if (options.getSkip().contains(job.getName())) {
                continue;
            }
            plan.add(job);
        }
        return plan;
    }

    /**
     * 校验并为每个选中作业创建运行实例，依赖图不合法时抛出 {@link JobGraphValidationException}。
     */
    public List<PipelineJob> build(RunOptions options) {
        JobGraphValidationResult validation = validate();
        if (!validation.isValid()) {
            throw new JobGraphValidationException(validation.getViolations());
        }
        MigrationConfig.Settings settings = migrationConfigService.getSettings();
        List<PipelineJob> jobs = new ArrayList<>();
        for (JobConfig job : plan(validation, options)) {
            String runId = runTimestampGenerator.next();
            JobRunEntity run = jobStateMachine.create(job.getName(), runId);
            JobProgressReporter reporter = new JobProgressReporter(jobRunRepository, run.getId(), job.getName());
            JobRunContext context = new JobRunContext(run.getId(), runId, job, settings, reporter, ledgerRegistry);
            jobs.add(new PipelineJob(context, jobStateMachine, ledgerRegistry, phaseProcessorFactory));
        }
        return jobs;
    }

    public RunSummary run(RunOptions options) {
        int configured = migrationConfigService.getMigrationConfig().getMigration().size();
        RunSummary summary = new RunSummary();
        if (options.isDryRun()) {
            JobGraphValidationResult validation = validate();
            List<JobConfig> plan = plan(validation, options);
            log.info("试运行，依赖图{}，以下作业将按顺序执行:", validation.isValid() ? "校验通过" : "存在违规");
            for (JobConfig job : plan) {
                log.info("  {} - {} (依赖: {})", job.getName(),
                    job.getDescription() == null ? "" : job.getDescription(), job.getDependsOn());
            }
            summary.setSkipped(configured - plan.size());
            return summary;
        }

        List<PipelineJob> jobs = build(options);
        summary.setSkipped(configured - jobs.size());
        try {
            for (PipelineJob job : jobs) {
                runJob(job, options.getPhase(), summary);
            }
        } finally {
            ledgerRegistry.unloadAll();
            log.info("迁移运行结束: processed={}, succeeded={}, failed={}, skipped={}",
                summary.getProcessed(), summary.getSucceeded(), summary.getFailed(), summary.getSkipped());
        }
        return summary;
    }

    private void runJob(PipelineJob job, PhaseType untilPhase, RunSummary summary) {
        log.info("作业开始: job={}, runId={}", job.getName(), job.getContext().getRunId());
        try {
            job.build();
            if (untilPhase == null) {
                job.process();
            } else {
                for (PhaseType phase : PhaseType.values()) {
                    job.process(phase);
                    if (phase == untilPhase) {
                        break;
                    }
                }
            }
            summary.recordSuccess();
            log.info("作业完成: job={}, status={}", job.getName(), job.getStatus());
        } catch (JobExecutionException e) {
            summary.recordFailure(job.getName());
            log.error("作业失败，继续下一个作业: job={}, phase={}", job.getName(), e.getPhase(), e);
        } catch (FatalMigrationException e) {
            summary.recordFailure(job.getName());
            log.error("致命错误，终止迁移运行: job={}", job.getName(), e);
            throw e;
        }
    }
}
