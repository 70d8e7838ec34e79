package org.csits.mig.server.exception;

/**
 * 迁移引擎异常基类。
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
