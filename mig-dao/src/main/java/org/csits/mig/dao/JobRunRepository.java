package org.csits.mig.dao;

import java.util.List;
import java.util.Optional;

/**
 * 作业运行记录仓储接口。
 */
public interface JobRunRepository {

    /**
     * 保存运行记录（新增或更新）
     */
    JobRunEntity save(JobRunEntity entity);

    Optional<JobRunEntity> findById(Long id);

    /**
     * 按作业名查询，最近创建的在前
     */
    List<JobRunEntity> findByJobName(String jobName);

    List<JobRunEntity> findAll();

    long count();
}
