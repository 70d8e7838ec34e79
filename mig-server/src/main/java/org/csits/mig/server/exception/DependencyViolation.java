package org.csits.mig.server.exception;

/**
 * 作业依赖图的一条校验违规。违规被收集而非立即抛出。
 */
public abstract class DependencyViolation {

    private final String jobName;

    protected DependencyViolation(String jobName) {
        this.jobName = jobName;
    }

    /**
     * 违规所在的作业。
     */
    public String getJobName() {
        return jobName;
    }

    public abstract String getMessage();

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
