package org.csits.mig.server.exception;

/**
 * 依赖作业的账本不存在或无法读取，且当前步骤声明其为必需。
 */
public class MissingDependencyDataException extends MigrationException {

    private final String dependency;

    public MissingDependencyDataException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
