package org.csits.mig.server.exception;

/**
 * 迁移配置缺失或格式错误。
 */
public class InvalidConfigurationException extends MigrationException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
