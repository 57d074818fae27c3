package com.whereq.warden.probe;

import com.whereq.warden.config.WardenProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Name to factory table of the available probes, with their category, tags and enabled state.
 *
 * Probe beans in the application context are registered at startup;
 * anything else has to be registered explicitly.
 */
@Slf4j
@Component
public class ProbeRegistry {

    private static final String PROBE_REQUIREMENT = "probe:";
    private static final String CLASS_REQUIREMENT = "class:";
    private static final String JAVA_REQUIREMENT = "java:";

    private final WardenProperties.RegistryConfig config;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public ProbeRegistry() {
        this(new WardenProperties.RegistryConfig());
    }

    public ProbeRegistry(WardenProperties.RegistryConfig config) {
        this.config = config;
    }

    @Autowired
    public ProbeRegistry(WardenProperties properties, ObjectProvider<Probe> probes) {
        this(properties.getRegistry());
        probes.orderedStream().forEach(probe -> register(probe.getDescriptor(), () -> probe));
        log.info("ProbeRegistry initialized with probes: {}", names());
    }

    /**
     * Register a probe factory under a name, replacing any previous registration
     */
    public ProbeRegistry register(String name, Supplier<? extends Probe> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Probe name must not be blank");
        }
        return register(ProbeDescriptor.of(name), factory);
    }

    /**
     * Register a probe factory with its metadata. Probes outside the allowed categories are ignored.
     */
    public ProbeRegistry register(ProbeDescriptor descriptor, Supplier<? extends Probe> factory) {
        if (descriptor == null || descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new IllegalArgumentException("Probe name must not be blank");
        }
        String name = descriptor.getName();
        if (factory == null) {
            throw new IllegalArgumentException("Probe factory must not be null: " + name);
        }
        if (!config.getAllowedCategories().isEmpty() && !config.getAllowedCategories().contains(descriptor.getCategory())) {
            log.info("Ignoring probe {}: category {} is not allowed", name, descriptor.getCategory());
            return this;
        }

        if (registrations.put(name, new Registration(descriptor, factory, config.isDefaultEnabled())) != null) {
            log.warn("Replaced probe registration: {}", name);
        } else {
            log.debug("Registered probe {} in category {}", name, descriptor.getCategory());
        }
        return this;
    }

    public boolean unregister(String name) {
        return name != null && registrations.remove(name) != null;
    }

    public boolean has(String name) {
        return name != null && registrations.containsKey(name);
    }

    /**
     * Create a probe instance
     *
     * @throws IllegalArgumentException if no probe is registered under the name
     */
    public Probe create(String name) {
        return find(name)
            .orElseThrow(() -> new IllegalArgumentException("Probe not found: " + name));
    }

    /**
     * Create a probe instance if one is registered under the name
     */
    public Optional<Probe> find(String name) {
        Registration registration = name != null ? registrations.get(name) : null;
        if (registration == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registration.factory.get());
    }

    public Optional<ProbeDescriptor> getDescriptor(String name) {
        Registration registration = name != null ? registrations.get(name) : null;
        return registration != null ? Optional.of(registration.descriptor) : Optional.empty();
    }

    public Set<String> names() {
        return new TreeSet<>(registrations.keySet());
    }

    public boolean isEnabled(String name) {
        Registration registration = name != null ? registrations.get(name) : null;
        return registration != null && registration.enabled;
    }

    /**
     * @return false if no probe is registered under the name
     */
    public boolean enable(String name) {
        return setEnabled(name, true);
    }

    public boolean disable(String name) {
        return setEnabled(name, false);
    }

    /**
     * @return number of probes enabled
     */
    public int enableCategory(String category) {
        return setEnabled(getByCategory(category), true);
    }

    public int disableCategory(String category) {
        return setEnabled(getByCategory(category), false);
    }

    /**
     * Enable every probe carrying at least one of the tags
     */
    public int enableByTags(Collection<String> tags) {
        return setEnabled(getByTags(tags), true);
    }

    public int disableByTags(Collection<String> tags) {
        return setEnabled(getByTags(tags), false);
    }

    /**
     * Names of the probes in a category, sorted
     */
    public List<String> getByCategory(String category) {
        return select(descriptor -> descriptor.getCategory().equals(category));
    }

    /**
     * Names of the probes carrying at least one of the tags, sorted
     */
    public List<String> getByTags(Collection<String> tags) {
        return select(descriptor -> descriptor.hasAnyTag(tags));
    }

    /**
     * Names of the probes whose name or description contains the query, ignoring case
     */
    public List<String> search(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return select(descriptor -> descriptor.getName().toLowerCase(Locale.ROOT).contains(needle)
            || descriptor.getDescription().toLowerCase(Locale.ROOT).contains(needle));
    }

    public List<String> getEnabled() {
        List<String> enabled = new ArrayList<>();
        for (String name : names()) {
            if (isEnabled(name)) {
                enabled.add(name);
            }
        }
        return enabled;
    }

    public Set<String> getCategories() {
        Set<String> categories = new TreeSet<>();
        registrations.values().forEach(registration -> categories.add(registration.descriptor.getCategory()));
        return categories;
    }

    public Set<String> getAllTags() {
        Set<String> tags = new TreeSet<>();
        registrations.values().forEach(registration -> tags.addAll(registration.descriptor.getTags()));
        return tags;
    }

    /**
     * Total, enabled and disabled probes per category, sorted by category
     */
    public Map<String, CategoryStats> getCategoryStats() {
        Map<String, int[]> counts = new TreeMap<>();
        for (Registration registration : registrations.values()) {
            int[] count = counts.computeIfAbsent(registration.descriptor.getCategory(), key -> new int[2]);
            count[registration.enabled ? 0 : 1]++;
        }

        Map<String, CategoryStats> stats = new TreeMap<>();
        counts.forEach((category, count) -> stats.put(category, CategoryStats.builder()
            .total(count[0] + count[1])
            .enabled(count[0])
            .disabled(count[1])
            .build()));
        return stats;
    }

    /**
     * Check every registered probe's requirements and conflicts
     *
     * @return the problems found, sorted by probe name; empty when everything can run together
     */
    public List<DependencyIssue> validateDependencies() {
        List<DependencyIssue> issues = new ArrayList<>();
        for (String name : names()) {
            ProbeDescriptor descriptor = registrations.get(name).descriptor;

            for (String requirement : descriptor.getRequires()) {
                if (!isSatisfied(requirement)) {
                    issues.add(DependencyIssue.builder()
                        .probeName(name)
                        .type(DependencyIssue.Type.MISSING_REQUIREMENT)
                        .detail(requirement)
                        .build());
                }
            }
            for (String conflict : descriptor.getConflicts()) {
                if (isEnabled(conflict)) {
                    issues.add(DependencyIssue.builder()
                        .probeName(name)
                        .type(DependencyIssue.Type.CONFLICT)
                        .detail(conflict)
                        .build());
                }
            }
        }

        if (!issues.isEmpty()) {
            log.warn("Probe dependency validation found {} issue(s)", issues.size());
        }
        return issues;
    }

    private boolean isSatisfied(String requirement) {
        if (requirement.startsWith(PROBE_REQUIREMENT)) {
            return isEnabled(requirement.substring(PROBE_REQUIREMENT.length()));
        }
        if (requirement.startsWith(CLASS_REQUIREMENT)) {
            try {
                Class.forName(requirement.substring(CLASS_REQUIREMENT.length()), false, getClass().getClassLoader());
                return true;
            } catch (ClassNotFoundException e) {
                return false;
            }
        }
        if (requirement.startsWith(JAVA_REQUIREMENT)) {
            try {
                return Runtime.version().feature() >= Integer.parseInt(requirement.substring(JAVA_REQUIREMENT.length()));
            } catch (NumberFormatException e) {
                log.warn("Invalid Java requirement: {}", requirement);
                return false;
            }
        }
        return true;
    }

    private List<String> select(Predicate<ProbeDescriptor> filter) {
        List<String> selected = new ArrayList<>();
        for (String name : names()) {
            Registration registration = registrations.get(name);
            if (registration != null && filter.test(registration.descriptor)) {
                selected.add(name);
            }
        }
        return selected;
    }

    private boolean setEnabled(String name, boolean enabled) {
        Registration registration = name != null ? registrations.get(name) : null;
        if (registration == null) {
            return false;
        }
        registration.enabled = enabled;
        return true;
    }

    private int setEnabled(List<String> names, boolean enabled) {
        int count = 0;
        for (String name : names) {
            if (setEnabled(name, enabled)) {
                count++;
            }
        }
        log.debug("{} {} probe(s)", enabled ? "Enabled" : "Disabled", count);
        return count;
    }

    private static class Registration {
        private final ProbeDescriptor descriptor;
        private final Supplier<? extends Probe> factory;
        private volatile boolean enabled;

        Registration(ProbeDescriptor descriptor, Supplier<? extends Probe> factory, boolean enabled) {
            this.descriptor = descriptor;
            this.factory = factory;
            this.enabled = enabled;
        }
    }
}
