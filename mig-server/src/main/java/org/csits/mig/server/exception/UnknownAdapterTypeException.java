package org.csits.mig.server.exception;

/**
 * 配置中的适配器类型标签没有对应实现。
 */
public class UnknownAdapterTypeException extends MigrationException {

    public UnknownAdapterTypeException(String kind, String type, String jobName) {
        super("未知的" + kind + "类型: type=" + type + ", job=" + jobName);
    }
}
