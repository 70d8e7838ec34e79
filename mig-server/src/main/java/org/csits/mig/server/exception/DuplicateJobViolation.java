package org.csits.mig.server.exception;

public class DuplicateJobViolation extends DependencyViolation {

    public DuplicateJobViolation(String jobName) {
        super(jobName);
    }

    @Override
    public String getMessage() {
        return "作业名重复: " + getJobName();
    }
}
