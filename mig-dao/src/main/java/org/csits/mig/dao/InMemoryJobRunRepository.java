package org.csits.mig.dao;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的作业运行仓储实现，进程退出即丢弃。
 */
@Repository
@ConditionalOnProperty(name = "mig.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobRunRepository implements JobRunRepository {

    private final AtomicLong idGenerator = new AtomicLong(0);

    private final Map<Long, JobRunEntity> store = new ConcurrentHashMap<>();

    @Override
    public JobRunEntity save(JobRunEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        if (entity.getId() == null) {
            entity.setId(idGenerator.incrementAndGet());
            if (entity.getCreatedAt() == null) {
                entity.setCreatedAt(now);
            }
            if (entity.getStartTime() == null) {
                entity.setStartTime(now);
            }
        }
        entity.setUpdatedAt(now);
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public Optional<JobRunEntity> findById(Long id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<JobRunEntity> findByJobName(String jobName) {
        return store.values().stream()
            .filter(e -> jobName.equals(e.getJobName()))
            .sorted(Comparator.comparing(JobRunEntity::getId).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<JobRunEntity> findAll() {
        List<JobRunEntity> all = new ArrayList<>(store.values());
        all.sort(Comparator.comparing(JobRunEntity::getId));
        return all;
    }

    @Override
    public long count() {
        return store.size();
    }
}
