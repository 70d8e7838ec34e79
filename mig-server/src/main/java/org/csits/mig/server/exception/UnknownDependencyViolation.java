package org.csits.mig.server.exception;

public class UnknownDependencyViolation extends DependencyViolation {

    private final String dependency;

    public UnknownDependencyViolation(String jobName, String dependency) {
        super(jobName);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }

    @Override
    public String getMessage() {
        return "作业 " + getJobName() + " 依赖未知作业 " + dependency;
    }
}
