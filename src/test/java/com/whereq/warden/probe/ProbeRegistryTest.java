package com.whereq.warden.probe;

import com.whereq.warden.config.WardenProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProbeRegistryTest {

    private final ProbeRegistry registry = new ProbeRegistry();

    @Test
    void create_shouldReturnFreshInstanceFromFactory() {
        registry.register("http_status", () -> ScriptedProbe.passing("http_status"));

        Probe first = registry.create("http_status");
        Probe second = registry.create("http_status");

        assertEquals("http_status", first.getName());
        assertNotSame(first, second);
    }

    @Test
    void create_shouldRejectUnknownProbe() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> registry.create("missing"));

        assertEquals("Probe not found: missing", error.getMessage());
    }

    @Test
    void find_shouldBeEmptyForUnknownProbe() {
        Optional<Probe> probe = registry.find("missing");

        assertTrue(probe.isEmpty());
    }

    @Test
    void register_shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", () -> ScriptedProbe.passing("x")));
        assertThrows(IllegalArgumentException.class, () -> registry.register("x", null));
    }

    @Test
    void names_shouldBeSortedAndReflectUnregister() {
        registry.register("ssl_certificate", () -> ScriptedProbe.passing("ssl_certificate"))
            .register("dns_lookup", () -> ScriptedProbe.passing("dns_lookup"));

        assertEquals(List.of("dns_lookup", "ssl_certificate"), List.copyOf(registry.names()));

        assertTrue(registry.unregister("dns_lookup"));
        assertFalse(registry.has("dns_lookup"));
        assertFalse(registry.unregister("dns_lookup"));
    }

    @Test
    void getByCategoryAndTags_shouldSelectSortedNames() {
        registerSamples();

        assertEquals(List.of("dns_lookup", "http_status"), registry.getByCategory("network"));
        assertEquals(List.of("hsts_header", "ssl_certificate"), registry.getByTags(List.of("tls")));
        assertEquals(List.of("dns_lookup", "hsts_header", "ssl_certificate"), registry.getByTags(List.of("tls", "fast")));
        assertTrue(registry.getByCategory("unknown").isEmpty());
        assertEquals(Set.of("network", "security"), registry.getCategories());
        assertEquals(Set.of("fast", "headers", "tls"), registry.getAllTags());
        assertEquals(List.of("ssl_certificate"), registry.search("CERTIFICATE"));
    }

    @Test
    void enableAndDisable_shouldToggleByCategoryAndTags() {
        registerSamples();
        assertEquals(4, registry.getEnabled().size());

        assertEquals(2, registry.disableCategory("security"));
        assertEquals(List.of("dns_lookup", "http_status"), registry.getEnabled());

        assertEquals(2, registry.enableByTags(List.of("tls")));
        assertEquals(List.of("dns_lookup", "hsts_header", "http_status", "ssl_certificate"), registry.getEnabled());

        assertEquals(1, registry.disableByTags(List.of("fast")));
        assertFalse(registry.isEnabled("dns_lookup"));
        assertTrue(registry.enable("dns_lookup"));
        assertTrue(registry.isEnabled("dns_lookup"));
        assertFalse(registry.disable("missing"));
        assertEquals(0, registry.enableCategory("unknown"));
    }

    @Test
    void getCategoryStats_shouldCountEnabledAndDisabled() {
        registerSamples();
        registry.disable("hsts_header");

        Map<String, CategoryStats> stats = registry.getCategoryStats();

        assertEquals(List.of("network", "security"), List.copyOf(stats.keySet()));
        assertEquals(CategoryStats.builder().total(2).enabled(2).disabled(0).build(), stats.get("network"));
        assertEquals(CategoryStats.builder().total(2).enabled(1).disabled(1).build(), stats.get("security"));
    }

    @Test
    void register_shouldHonourConfiguredDefaults() {
        WardenProperties.RegistryConfig config = new WardenProperties.RegistryConfig();
        config.setDefaultEnabled(false);
        config.getAllowedCategories().add("security");
        ProbeRegistry restricted = new ProbeRegistry(config);

        restricted.register(descriptor("ssl_certificate", "security"), () -> ScriptedProbe.passing("ssl_certificate"));
        restricted.register(descriptor("dns_lookup", "network"), () -> ScriptedProbe.passing("dns_lookup"));

        assertEquals(Set.of("ssl_certificate"), restricted.names());
        assertFalse(restricted.isEnabled("ssl_certificate"));
        assertEquals(ProbeDescriptor.DEFAULT_CATEGORY, ProbeDescriptor.of("x").getCategory());
    }

    @Test
    void validateDependencies_shouldReportMissingRequirementsAndConflicts() {
        registry.register(ProbeDescriptor.builder()
                .name("hsts_header")
                .require("probe:ssl_certificate")
                .require("class:java.lang.String")
                .require("class:com.example.Missing")
                .require("java:17")
                .require("java:999")
                .require("os:linux")
                .build(), () -> ScriptedProbe.passing("hsts_header"))
            .register(ProbeDescriptor.builder()
                .name("legacy_tls")
                .conflict("ssl_certificate")
                .conflict("http_status")
                .build(), () -> ScriptedProbe.passing("legacy_tls"))
            .register("http_status", () -> ScriptedProbe.passing("http_status"));

        assertEquals(List.of(
            issue("hsts_header", DependencyIssue.Type.MISSING_REQUIREMENT, "probe:ssl_certificate"),
            issue("hsts_header", DependencyIssue.Type.MISSING_REQUIREMENT, "class:com.example.Missing"),
            issue("hsts_header", DependencyIssue.Type.MISSING_REQUIREMENT, "java:999"),
            issue("legacy_tls", DependencyIssue.Type.CONFLICT, "http_status")), registry.validateDependencies());

        registry.register("ssl_certificate", () -> ScriptedProbe.passing("ssl_certificate"));
        registry.disable("http_status");

        assertEquals(List.of(
            issue("hsts_header", DependencyIssue.Type.MISSING_REQUIREMENT, "class:com.example.Missing"),
            issue("hsts_header", DependencyIssue.Type.MISSING_REQUIREMENT, "java:999"),
            issue("legacy_tls", DependencyIssue.Type.CONFLICT, "ssl_certificate")), registry.validateDependencies());
    }

    private void registerSamples() {
        registry.register(ProbeDescriptor.builder().name("http_status").category("network").build(),
                () -> ScriptedProbe.passing("http_status"))
            .register(ProbeDescriptor.builder().name("dns_lookup").category("network").tag("fast").build(),
                () -> ScriptedProbe.passing("dns_lookup"))
            .register(ProbeDescriptor.builder().name("ssl_certificate").category("security").tag("tls")
                    .description("Checks the certificate chain").build(),
                () -> ScriptedProbe.passing("ssl_certificate"))
            .register(ProbeDescriptor.builder().name("hsts_header").category("security").tag("tls").tag("headers").build(),
                () -> ScriptedProbe.passing("hsts_header"));
    }

    private static ProbeDescriptor descriptor(String name, String category) {
        return ProbeDescriptor.builder().name(name).category(category).build();
    }

    private static DependencyIssue issue(String probeName, DependencyIssue.Type type, String detail) {
        return DependencyIssue.builder().probeName(probeName).type(type).detail(detail).build();
    }
}
