package org.csits.mig.server.exception;

/**
 * 依赖作业在配置中排在依赖方之后。
 */
public class OrderViolation extends DependencyViolation {

    private final String dependency;

    public OrderViolation(String jobName, String dependency) {
        super(jobName);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }

    @Override
    public String getMessage() {
        return "作业 " + getJobName() + " 的依赖 " + dependency + " 在配置中位于其后";
    }
}
