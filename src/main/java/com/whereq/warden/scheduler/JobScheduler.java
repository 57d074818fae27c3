package com.whereq.warden.scheduler;

import com.whereq.warden.config.WardenProperties;
import com.whereq.warden.graph.DependencyGraph;
import com.whereq.warden.model.DependencyAnalysis;
import com.whereq.warden.model.ProbeJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reorders the jobs of a batch for execution.
 *
 * Steps run in a fixed order: topological reordering, priority sort, load
 * balancing, adaptive batching. Each step except the first can be switched off.
 * The result never places a job ahead of its in-batch dependencies.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class JobScheduler {

    private static final double HEAVY_COMPLEXITY = 2.0;
    private static final double LIGHT_COMPLEXITY = 0.5;

    private final WardenProperties.SchedulerConfig config;

    @Autowired
    public JobScheduler(WardenProperties properties) {
        this(properties.getScheduler());
    }

    public JobScheduler(WardenProperties.SchedulerConfig config) {
        this.config = config;
    }

    /**
     * Produce the execution order of a batch
     *
     * @param analysis dependency analysis of the same jobs, null to skip dependency handling
     */
    public List<ProbeJob> optimize(List<ProbeJob> jobs, DependencyAnalysis analysis) {
        List<ProbeJob> optimized = new ArrayList<>(jobs);

        if (analysis != null && analysis.getOrder() != null) {
            optimized = DependencyGraph.reorder(optimized, analysis.getOrder());
        }
        if (config.isPriorityScheduling()) {
            optimized = applyPriorityScheduling(optimized);
        }
        if (config.isLoadBalancing()) {
            optimized = applyLoadBalancing(optimized);
        }
        if (config.isAdaptiveBatching()) {
            optimized = applyAdaptiveBatching(optimized);
        }
        if (analysis != null) {
            optimized = enforceDependencyOrder(optimized, analysis);
        }

        log.debug("Scheduled {} jobs: {}", optimized.size(),
            optimized.stream().map(ProbeJob::getId).collect(Collectors.toList()));
        return optimized;
    }

    /**
     * Higher priority first; equal priorities run shorter jobs first. Stable.
     */
    public List<ProbeJob> applyPriorityScheduling(List<ProbeJob> jobs) {
        List<ProbeJob> sorted = new ArrayList<>(jobs);
        sorted.sort(Comparator.comparingInt(ProbeJob::getPriority).reversed()
            .thenComparingDouble(ProbeJob::getEstimatedDuration));
        return sorted;
    }

    /**
     * Interleave heavy, medium and light jobs round-robin
     */
    public List<ProbeJob> applyLoadBalancing(List<ProbeJob> jobs) {
        if (jobs.size() <= 1) {
            return new ArrayList<>(jobs);
        }

        List<ProbeJob> heavy = new ArrayList<>();
        List<ProbeJob> medium = new ArrayList<>();
        List<ProbeJob> light = new ArrayList<>();
        for (ProbeJob job : jobs) {
            if (job.getComplexity() <= LIGHT_COMPLEXITY) {
                light.add(job);
            } else if (job.getComplexity() <= HEAVY_COMPLEXITY) {
                medium.add(job);
            } else {
                heavy.add(job);
            }
        }

        List<ProbeJob> result = new ArrayList<>(jobs.size());
        int rounds = Collections.max(List.of(heavy.size(), medium.size(), light.size()));
        for (int i = 0; i < rounds; i++) {
            for (List<ProbeJob> group : List.of(heavy, medium, light)) {
                if (i < group.size()) {
                    result.add(group.get(i));
                }
            }
        }
        return result;
    }

    /**
     * Keep jobs of the same probe against the same host together, in chunks sized by the batch size
     */
    public List<ProbeJob> applyAdaptiveBatching(List<ProbeJob> jobs) {
        int batchSize = calculateOptimalBatchSize(jobs.size());

        Map<String, List<ProbeJob>> groups = new LinkedHashMap<>();
        for (ProbeJob job : jobs) {
            groups.computeIfAbsent(groupKey(job), key -> new ArrayList<>()).add(job);
        }

        List<ProbeJob> result = new ArrayList<>(jobs.size());
        for (List<ProbeJob> group : groups.values()) {
            for (int from = 0; from < group.size(); from += batchSize) {
                result.addAll(group.subList(from, Math.min(from + batchSize, group.size())));
            }
        }
        return result;
    }

    public int calculateOptimalBatchSize(int totalJobs) {
        if (totalJobs <= 10) {
            return 3;
        } else if (totalJobs <= 50) {
            return 5;
        } else if (totalJobs <= 200) {
            return 10;
        }
        return 20;
    }

    /**
     * Stable reorder that moves every job behind its in-batch dependencies,
     * otherwise keeping the given order
     */
    public List<ProbeJob> enforceDependencyOrder(List<ProbeJob> jobs, DependencyAnalysis analysis) {
        Map<String, Integer> position = new HashMap<>();
        Map<String, ProbeJob> byId = new HashMap<>();
        for (int i = 0; i < jobs.size(); i++) {
            position.put(jobs.get(i).getId(), i);
            byId.put(jobs.get(i).getId(), jobs.get(i));
        }

        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (ProbeJob job : jobs) {
            Set<String> dependencies = analysis.getDependencies() != null
                ? analysis.getDependencies().getOrDefault(job.getId(), Set.of())
                : job.getDependencies();
            int count = 0;
            for (String dependency : dependencies) {
                if (byId.containsKey(dependency)) {
                    dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(job.getId());
                    count++;
                }
            }
            pending.put(job.getId(), count);
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(position::get));
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });

        List<ProbeJob> ordered = new ArrayList<>(jobs.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            ordered.add(byId.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < jobs.size()) {
            for (ProbeJob job : jobs) {
                if (pending.get(job.getId()) > 0) {
                    ordered.add(job);
                }
            }
        }
        return ordered;
    }

    /**
     * Keep the most valuable jobs that fit into a time budget.
     * Jobs are ranked by priority per second of estimated duration.
     *
     * @param deadlineSeconds time budget in seconds
     */
    public List<ProbeJob> optimizeForDeadline(List<ProbeJob> jobs, double deadlineSeconds) {
        List<ProbeJob> ranked = new ArrayList<>(jobs);
        ranked.sort(Comparator.comparingDouble(JobScheduler::efficiency).reversed());

        List<ProbeJob> admitted = new ArrayList<>();
        double planned = 0;
        for (ProbeJob job : ranked) {
            if (planned + job.getEstimatedDuration() <= deadlineSeconds) {
                admitted.add(job);
                planned += job.getEstimatedDuration();
            } else {
                log.warn("Dropping job {} ({}): estimated {}s does not fit the {}s deadline",
                    job.getId(), job.getProbeName(), job.getEstimatedDuration(), deadlineSeconds);
            }
        }
        return admitted;
    }

    /**
     * Expected wall-clock time: the sequential sum blended with the longest job
     * by the fraction of jobs without dependencies
     */
    public double estimateExecutionTime(List<ProbeJob> jobs) {
        if (jobs.isEmpty()) {
            return 0.0;
        }

        double sequential = 0;
        double longest = 0;
        int independent = 0;
        for (ProbeJob job : jobs) {
            sequential += job.getEstimatedDuration();
            longest = Math.max(longest, job.getEstimatedDuration());
            if (job.getDependencies().isEmpty()) {
                independent++;
            }
        }

        double factor = (double) independent / jobs.size();
        return sequential * (1 - factor) + longest * factor;
    }

    /**
     * Insert a job in front of the first queued job with lower priority
     */
    public List<ProbeJob> schedulePriorityJob(ProbeJob job, List<ProbeJob> queue) {
        List<ProbeJob> result = new ArrayList<>(queue);
        int position = result.size();
        for (int i = 0; i < result.size(); i++) {
            if (job.getPriority() > result.get(i).getPriority()) {
                position = i;
                break;
            }
        }
        result.add(position, job);
        return result;
    }

    private static double efficiency(ProbeJob job) {
        return job.getEstimatedDuration() > 0 ? job.getPriority() / job.getEstimatedDuration() : 0.0;
    }

    private static String groupKey(ProbeJob job) {
        return (job.getProbeName() != null ? job.getProbeName() : "unknown") + ":" + hostOf(job.getTarget());
    }

    static String hostOf(String target) {
        if (target == null || target.isBlank()) {
            return "unknown";
        }
        try {
            String host = URI.create(target.trim()).getHost();
            return host != null ? host : "unknown";
        } catch (IllegalArgumentException e) {
            return "unknown";
        }
    }
}
