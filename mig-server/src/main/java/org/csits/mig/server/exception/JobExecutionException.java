package org.csits.mig.server.exception;

import org.csits.mig.server.constants.PhaseType;

/**
 * 单个作业执行失败，流水线记录后继续下一个作业。
 */
public class JobExecutionException extends MigrationException {

    private final String jobName;

    private final PhaseType phase;

    public JobExecutionException(String jobName, PhaseType phase, Throwable cause) {
        super("作业执行失败: job=" + jobName + ", phase=" + phase + ", cause=" + cause.getMessage(), cause);
        this.jobName = jobName;
        this.phase = phase;
    }

    public String getJobName() {
        return jobName;
    }

    public PhaseType getPhase() {
        return phase;
    }
}
