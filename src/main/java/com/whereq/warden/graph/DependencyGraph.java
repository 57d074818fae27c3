package com.whereq.warden.graph;

import com.whereq.warden.exception.CyclicDependencyException;
import com.whereq.warden.model.CriticalPath;
import com.whereq.warden.model.DependencyAnalysis;
import com.whereq.warden.model.ProbeJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Analyzes the dependency relation between the jobs of a batch.
 *
 * Dependencies on ids outside the batch are treated as external: they add no
 * edges and do not block ordering.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class DependencyGraph {

    private volatile DependencyAnalysis lastAnalysis;

    /**
     * Analyze a batch
     *
     * @throws CyclicDependencyException if the in-batch dependencies form a cycle
     */
    public DependencyAnalysis analyze(List<ProbeJob> jobs) {
        Map<String, Set<String>> dependencies = buildDependencies(jobs);
        Map<String, Set<String>> reverse = buildReverse(dependencies);

        detectCycles(dependencies);

        List<String> order = topologicalOrder(dependencies, reverse);
        Map<String, Integer> depth = depths(dependencies, order);
        CriticalPath criticalPath = criticalPath(depth, order);
        List<List<String>> groups = parallelGroups(depth, order);

        int nodes = dependencies.size();
        int edges = dependencies.values().stream().mapToInt(Set::size).sum();
        int largestGroup = groups.stream().mapToInt(List::size).max().orElse(0);

        DependencyAnalysis.GraphStats stats = DependencyAnalysis.GraphStats.builder()
            .totalNodes(nodes)
            .totalEdges(edges)
            .maxDepth(criticalPath.getLength())
            .parallelizationFactor(nodes > 0 ? (double) largestGroup / nodes : 0.0)
            .dependencyDensity(nodes > 1 ? (double) edges / ((long) nodes * (nodes - 1)) : 0.0)
            .build();

        DependencyAnalysis analysis = DependencyAnalysis.builder()
            .dependencies(dependencies)
            .reverseDependencies(reverse)
            .order(order)
            .criticalPath(criticalPath)
            .parallelGroups(groups)
            .stats(stats)
            .build();

        log.debug("Analyzed {} jobs: edges={}, maxDepth={}, groups={}", nodes, edges, criticalPath.getLength(), groups.size());
        this.lastAnalysis = analysis;
        return analysis;
    }

    /**
     * Reorder jobs by the last analysis' order, analyzing them first if nothing was analyzed yet
     */
    public List<ProbeJob> optimizeExecutionOrder(List<ProbeJob> jobs) {
        DependencyAnalysis analysis = lastAnalysis != null ? lastAnalysis : analyze(jobs);
        return reorder(jobs, analysis.getOrder());
    }

    /**
     * Stats of the last analysis, null before the first one
     */
    public DependencyAnalysis.GraphStats getStats() {
        DependencyAnalysis analysis = lastAnalysis;
        return analysis != null ? analysis.getStats() : null;
    }

    public DependencyAnalysis getLastAnalysis() {
        return lastAnalysis;
    }

    /**
     * Jobs in the given id order; jobs the order does not mention keep their relative order at the end
     */
    public static List<ProbeJob> reorder(List<ProbeJob> jobs, List<String> order) {
        Map<String, ProbeJob> byId = new LinkedHashMap<>();
        for (ProbeJob job : jobs) {
            byId.put(job.getId(), job);
        }

        List<ProbeJob> ordered = new ArrayList<>(jobs.size());
        for (String id : order) {
            ProbeJob job = byId.remove(id);
            if (job != null) {
                ordered.add(job);
            }
        }
        ordered.addAll(byId.values());
        return ordered;
    }

    private Map<String, Set<String>> buildDependencies(List<ProbeJob> jobs) {
        Set<String> ids = new HashSet<>();
        for (ProbeJob job : jobs) {
            ids.add(job.getId());
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (ProbeJob job : jobs) {
            Set<String> inBatch = new LinkedHashSet<>();
            for (String dependency : job.getDependencies()) {
                if (ids.contains(dependency)) {
                    inBatch.add(dependency);
                } else {
                    log.debug("Job {} depends on {} outside the batch, treated as external", job.getId(), dependency);
                }
            }
            dependencies.put(job.getId(), inBatch);
        }
        return dependencies;
    }

    private Map<String, Set<String>> buildReverse(Map<String, Set<String>> dependencies) {
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (String id : dependencies.keySet()) {
            reverse.put(id, new LinkedHashSet<>());
        }
        dependencies.forEach((id, deps) -> deps.forEach(dep -> reverse.get(dep).add(id)));
        return reverse;
    }

    private void detectCycles(Map<String, Set<String>> dependencies) {
        Set<String> visited = new HashSet<>();
        List<String> cycles = new ArrayList<>();

        for (String node : dependencies.keySet()) {
            if (!visited.contains(node)) {
                String cycle = findCycle(node, dependencies, visited);
                if (cycle != null) {
                    cycles.add(cycle);
                }
            }
        }

        if (!cycles.isEmpty()) {
            throw new CyclicDependencyException(cycles);
        }
    }

    /**
     * Depth-first walk from root with an explicit stack, so long chains do not exhaust the thread stack
     *
     * @return the back edge closing a cycle, null when none is reachable from root
     */
    private String findCycle(String root, Map<String, Set<String>> dependencies, Set<String> visited) {
        Deque<String> path = new ArrayDeque<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();

        visited.add(root);
        onPath.add(root);
        path.push(root);
        pending.push(dependencies.get(root).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                onPath.remove(path.pop());
                continue;
            }

            String dependency = next.next();
            if (onPath.contains(dependency)) {
                return path.peek() + " -> " + dependency;
            }
            if (visited.add(dependency)) {
                onPath.add(dependency);
                path.push(dependency);
                pending.push(dependencies.get(dependency).iterator());
            }
        }
        return null;
    }

    private List<String> topologicalOrder(Map<String, Set<String>> dependencies, Map<String, Set<String>> reverse) {
        Map<String, Integer> position = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            position.put(entry.getKey(), index++);
            inDegree.put(entry.getKey(), entry.getValue().size());
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(position::get));
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                ready.add(node);
            }
        });

        Set<String> order = new LinkedHashSet<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String dependent : reverse.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        // only reachable when a cycle slipped through
        order.addAll(dependencies.keySet());
        return new ArrayList<>(order);
    }

    /**
     * Longest chain of dependencies ending at each node, in edges
     */
    private Map<String, Integer> depths(Map<String, Set<String>> dependencies, List<String> order) {
        Map<String, Integer> depth = new HashMap<>();
        for (String node : order) {
            int longest = 0;
            for (String dependency : dependencies.get(node)) {
                Integer dependencyDepth = depth.get(dependency);
                if (dependencyDepth != null) {
                    longest = Math.max(longest, dependencyDepth + 1);
                }
            }
            depth.put(node, longest);
        }
        return depth;
    }

    private CriticalPath criticalPath(Map<String, Integer> depth, List<String> order) {
        if (order.isEmpty()) {
            return CriticalPath.EMPTY;
        }

        int length = depth.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<String> nodes = new ArrayList<>();
        for (String node : order) {
            if (depth.get(node) == length) {
                nodes.add(node);
            }
        }
        return new CriticalPath(length, nodes);
    }

    /**
     * One group per depth level. A dependency path always increases depth,
     * so members of a level never depend on each other in either direction.
     */
    private List<List<String>> parallelGroups(Map<String, Integer> depth, List<String> order) {
        Map<Integer, List<String>> levels = new TreeMap<>();
        for (String node : order) {
            levels.computeIfAbsent(depth.get(node), level -> new ArrayList<>()).add(node);
        }
        return new ArrayList<>(levels.values());
    }
}
