package org.csits.mig.server.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.csits.mig.server.dto.JobConfig;

/**
 * 作业依赖图：作业名 -> 声明的依赖与配置顺序。重名作业只保留首次出现。
 */
public final class JobGraph {

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    private final Set<String> duplicates = new LinkedHashSet<>();

    private JobGraph() {
    }

    public static JobGraph of(List<JobConfig> jobs) {
        JobGraph graph = new JobGraph();
        int index = 0;
        for (JobConfig job : jobs) {
            String name = job.getName();
            if (graph.nodes.containsKey(name)) {
                graph.duplicates.add(name);
            } else {
                List<String> deps = job.getDependsOn() == null
                    ? Collections.emptyList()
                    : new ArrayList<>(job.getDependsOn());
                graph.nodes.put(name, new Node(name, index, deps, job));
            }
            index++;
        }
        return graph;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public Node get(String name) {
        return nodes.get(name);
    }

    /**
     * 按配置顺序排列的作业名。
     */
    public List<String> names() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<String> dependenciesOf(String name) {
        Node node = nodes.get(name);
        return node == null ? Collections.emptyList() : node.getDependencies();
    }

    public Set<String> getDuplicates() {
        return Collections.unmodifiableSet(duplicates);
    }

    public static final class Node {

        private final String name;

        private final int index;

        private final List<String> dependencies;

        private final JobConfig config;

        Node(String name, int index, List<String> dependencies, JobConfig config) {
            this.name = name;
            this.index = index;
            this.dependencies = Collections.unmodifiableList(dependencies);
            this.config = config;
        }

        public String getName() {
            return name;
        }

        public int getIndex() {
            return index;
        }

        public List<String> getDependencies() {
            return dependencies;
        }

        public JobConfig getConfig() {
            return config;
        }
    }
}
