package org.csits.mig.server.exception;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 作业依赖图校验未通过，整个运行不会开始。
 */
public class JobGraphValidationException extends FatalMigrationException {

    private final List<DependencyViolation> violations;

    public JobGraphValidationException(List<DependencyViolation> violations) {
        super("作业依赖图校验失败: " + violations.stream()
            .map(DependencyViolation::getMessage)
            .collect(Collectors.joining("; ")));
        this.violations = Collections.unmodifiableList(violations);
    }

    public List<DependencyViolation> getViolations() {
        return violations;
    }
}
