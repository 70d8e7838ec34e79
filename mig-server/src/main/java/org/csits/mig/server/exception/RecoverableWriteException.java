package org.csits.mig.server.exception;

/**
 * 目标写入的可恢复失败，例如目标库拒绝单行。加载器链记录告警后继续。
 */
public class RecoverableWriteException extends MigrationException {

    public RecoverableWriteException(String message) {
        super(message);
    }

    public RecoverableWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
