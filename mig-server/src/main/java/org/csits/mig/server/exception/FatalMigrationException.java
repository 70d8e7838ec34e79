package org.csits.mig.server.exception;

/**
 * 致命错误，终止整个运行，后续作业不再执行。
 */
public class FatalMigrationException extends MigrationException {

    public FatalMigrationException(String message) {
        super(message);
    }

    public FatalMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
