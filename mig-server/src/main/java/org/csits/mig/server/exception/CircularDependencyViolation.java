package org.csits.mig.server.exception;

import java.util.Collections;
import java.util.List;

/**
 * 循环依赖，cycle 为完整路径，首尾相同，例如 [a, b, a]。
 */
public class CircularDependencyViolation extends DependencyViolation {

    private final List<String> cycle;

    public CircularDependencyViolation(List<String> cycle) {
        super(cycle.get(0));
        this.cycle = Collections.unmodifiableList(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }

    @Override
    public String getMessage() {
        return "检测到循环依赖: " + String.join(" -> ", cycle);
    }
}
