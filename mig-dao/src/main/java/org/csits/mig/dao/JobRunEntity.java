package org.csits.mig.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 作业运行记录。
 */
@Data
public class JobRunEntity {

    private Long id;

    private String jobName;

    /**
     * 运行标识，与本次运行写出的账本文件名时间戳一致。
     */
    private String runId;

    private JobRunStatus status;

    private String currentPhase;

    private long rowsProcessed;

    private String errorMessage;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
