package org.csits.mig.server.service;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.exception.DependencyViolation;

/**
 * 依赖图校验结果：全部违规与执行计划。
 */
public class JobGraphValidationResult {

    private final List<DependencyViolation> violations;

    private final List<JobConfig> executionPlan;

    private final Set<String> excluded;

    public JobGraphValidationResult(List<DependencyViolation> violations, List<JobConfig> executionPlan,
                                    Set<String> excluded) {
        this.violations = Collections.unmodifiableList(violations);
        this.executionPlan = Collections.unmodifiableList(executionPlan);
        this.excluded = Collections.unmodifiableSet(excluded);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<DependencyViolation> getViolations() {
        return violations;
    }

    public <T extends DependencyViolation> List<T> getViolations(Class<T> type) {
        return violations.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    /**
     * 按配置顺序、去除 skip 与因依赖问题被排除的作业。
     */
    public List<JobConfig> getExecutionPlan() {
        return executionPlan;
    }

    /**
     * 因未知依赖或循环依赖（含传递）被排除的作业。
     */
    public Set<String> getExcluded() {
        return excluded;
    }
}
