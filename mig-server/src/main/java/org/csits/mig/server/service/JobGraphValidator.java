package org.csits.mig.server.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.exception.CircularDependencyViolation;
import org.csits.mig.server.exception.DependencyViolation;
import org.csits.mig.server.exception.DuplicateJobViolation;
import org.csits.mig.server.exception.OrderViolation;
import org.csits.mig.server.exception.UnknownDependencyViolation;
import org.springframework.stereotype.Component;

/**
 * 作业依赖图校验：重名、循环依赖、未知依赖、顺序违规。所有违规一并收集。
 */
@Slf4j
@Component
public class JobGraphValidator {

    private enum Mark {
        VISITING,
        DONE
    }

    public JobGraphValidationResult validate(List<JobConfig> jobs) {
        JobGraph graph = JobGraph.of(jobs);
        List<DependencyViolation> violations = new ArrayList<>();

        for (String duplicate : graph.getDuplicates()) {
            violations.add(new DuplicateJobViolation(duplicate));
        }

        List<List<String>> cycles = findCycles(graph);
        Set<String> onCycle = new HashSet<>();
        for (List<String> cycle : cycles) {
            violations.add(new CircularDependencyViolation(cycle));
            onCycle.addAll(cycle);
        }

        Set<String> withUnknown = new HashSet<>();
        for (String name : graph.names()) {
            JobGraph.Node node = graph.get(name);
            for (String dep : node.getDependencies()) {
                if (!graph.contains(dep)) {
                    violations.add(new UnknownDependencyViolation(name, dep));
                    withUnknown.add(name);
                } else if (graph.get(dep).getIndex() > node.getIndex()) {
                    violations.add(new OrderViolation(name, dep));
                }
            }
        }

        Set<String> excluded = exclude(graph, onCycle, withUnknown);
        List<JobConfig> plan = new ArrayList<>();
        for (String name : graph.names()) {
            JobConfig config = graph.get(name).getConfig();
            if (!config.isSkip() && !excluded.contains(name)) {
                plan.add(config);
            }
        }

        for (DependencyViolation violation : violations) {
            log.error("依赖校验失败: {}", violation.getMessage());
        }
        if (!excluded.isEmpty()) {
            log.warn("以下作业因依赖问题被排除: {}", excluded);
        }
        return new JobGraphValidationResult(violations, plan, excluded);
    }

    /**
     * 深度优先遍历，遇到路径栈中的作业即为一个环。同一个环的不同旋转只报告一次。
     */
    List<List<String>> findCycles(JobGraph graph) {
        Map<String, Mark> marks = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        Set<List<String>> seen = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String name : graph.names()) {
            if (!marks.containsKey(name)) {
                visit(graph, name, marks, path, seen, cycles);
            }
        }
        return cycles;
    }

    private void visit(JobGraph graph, String name, Map<String, Mark> marks, Deque<String> path,
                       Set<List<String>> seen, List<List<String>> cycles) {
        marks.put(name, Mark.VISITING);
        path.addLast(name);
        for (String dep : graph.dependenciesOf(name)) {
            if (!graph.contains(dep)) {
                continue;
            }
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                List<String> cycle = extractCycle(path, dep);
                if (seen.add(canonical(graph, cycle))) {
                    cycles.add(cycle);
                }
            } else if (mark == null) {
                visit(graph, dep, marks, path, seen, cycles);
            }
        }
        path.removeLast();
        marks.put(name, Mark.DONE);
    }

    private List<String> extractCycle(Deque<String> path, String start) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String step : path) {
            if (step.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(step);
            }
        }
        cycle.add(start);
        return cycle;
    }

    /**
     * 以配置顺序最靠前的作业为起点旋转，用于去重。
     */
    private List<String> canonical(JobGraph graph, List<String> cycle) {
        List<String> ring = cycle.subList(0, cycle.size() - 1);
        int best = 0;
        for (int i = 1; i < ring.size(); i++) {
            if (graph.get(ring.get(i)).getIndex() < graph.get(ring.get(best)).getIndex()) {
                best = i;
            }
        }
        List<String> rotated = new ArrayList<>(ring.size());
        for (int i = 0; i < ring.size(); i++) {
            rotated.add(ring.get((best + i) % ring.size()));
        }
        return rotated;
    }

    private Set<String> exclude(JobGraph graph, Set<String> onCycle, Set<String> withUnknown) {
        Set<String> excluded = new LinkedHashSet<>();
        for (String name : graph.names()) {
            if (onCycle.contains(name) || withUnknown.contains(name)) {
                excluded.add(name);
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String name : graph.names()) {
                if (excluded.contains(name)) {
                    continue;
                }
                for (String dep : graph.dependenciesOf(name)) {
                    if (excluded.contains(dep)) {
                        excluded.add(name);
                        changed = true;
                        break;
                    }
                }
            }
        }
        return excluded;
    }
}
