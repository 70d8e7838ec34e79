package org.csits.mig.dao;

/**
 * 作业运行状态。
 */
public enum JobRunStatus {
    BUILT,
    EXTRACT_RUNNING,
    TRANSFORM_RUNNING,
    LOAD_RUNNING,
    DONE,
    FAILED;

    public boolean isRunning() {
        return this == EXTRACT_RUNNING || this == TRANSFORM_RUNNING || this == LOAD_RUNNING;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
