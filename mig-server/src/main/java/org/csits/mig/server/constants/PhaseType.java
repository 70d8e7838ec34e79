package org.csits.mig.server.constants;

import org.csits.mig.dao.JobRunStatus;

/**
 * 作业阶段，按声明顺序执行。
 */
public enum PhaseType {

    EXTRACT(JobRunStatus.EXTRACT_RUNNING),

    TRANSFORM(JobRunStatus.TRANSFORM_RUNNING),

    LOAD(JobRunStatus.LOAD_RUNNING);

    private final JobRunStatus runningStatus;

    PhaseType(JobRunStatus runningStatus) {
        this.runningStatus = runningStatus;
    }

    public JobRunStatus getRunningStatus() {
        return runningStatus;
    }

    /**
     * 按名称解析，不区分大小写，例如命令行 --phase=extract。
     */
    public static PhaseType fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("阶段名不能为空");
        }
        for (PhaseType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知阶段: " + name);
    }
}
