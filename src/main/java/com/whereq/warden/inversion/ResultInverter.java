package com.whereq.warden.inversion;

import com.whereq.warden.exception.UnknownInversionRuleException;
import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named inversion rules and their application to results.
 *
 * Inversion lets a caller declare that a probe's raw outcome means the opposite
 * in its context, e.g. a probe that detects an open admin panel "passes" when
 * the panel is found, which is a security failure.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class ResultInverter {

    public static final String NONE = "none";

    public static final String EXPECT_FAILURE = "expect_failure";
    public static final String EXPECT_WARNING = "expect_warning";
    public static final String SECURITY_INVERTED = "security_inverted";
    public static final String AVAILABILITY_INVERTED = "availability_inverted";
    public static final String COMPLIANCE_STRICT = "compliance_strict";
    public static final String COMPLIANCE_LENIENT = "compliance_lenient";

    private static final List<String> REQUIRED_RULES = List.of(EXPECT_FAILURE, SECURITY_INVERTED);

    private final Map<String, InversionRule> rules = new ConcurrentHashMap<>();

    public ResultInverter() {
        registerDefaultRules();
    }

    private void registerDefaultRules() {
        rules.put(EXPECT_FAILURE, InversionRule.swap(ResultStatus.PASS, ResultStatus.FAIL));
        rules.put(EXPECT_WARNING, InversionRule.swap(ResultStatus.PASS, ResultStatus.WARNING));
        rules.put(SECURITY_INVERTED, InversionRule.swap(ResultStatus.PASS, ResultStatus.FAIL));
        // timeout and error collapse to fail first, so both end up as pass
        rules.put(AVAILABILITY_INVERTED, InversionRule.replace(ResultStatus.TIMEOUT, ResultStatus.FAIL)
            .andThen(InversionRule.replace(ResultStatus.ERROR, ResultStatus.FAIL))
            .andThen(InversionRule.swap(ResultStatus.PASS, ResultStatus.FAIL)));
        rules.put(COMPLIANCE_STRICT, InversionRule.replace(ResultStatus.WARNING, ResultStatus.FAIL));
        rules.put(COMPLIANCE_LENIENT, InversionRule.replace(ResultStatus.FAIL, ResultStatus.WARNING));
    }

    public void addRule(String name, InversionRule rule) {
        if (name == null || name.isBlank() || NONE.equals(name)) {
            throw new IllegalArgumentException("Invalid inversion rule name: " + name);
        }
        if (rules.put(name, rule) != null) {
            log.info("Replaced inversion rule: {}", name);
        }
    }

    public boolean removeRule(String name) {
        return rules.remove(name) != null;
    }

    public boolean hasRule(String name) {
        return isNone(name) || rules.containsKey(name);
    }

    public Set<String> getAvailableRules() {
        return new TreeSet<>(rules.keySet());
    }

    /**
     * Register a rule from a list of from/to mappings; the first mapping matching a status wins
     */
    public void createProfile(String name, List<Map.Entry<ResultStatus, ResultStatus>> mappings) {
        Map<ResultStatus, ResultStatus> table = new EnumMap<>(ResultStatus.class);
        for (Map.Entry<ResultStatus, ResultStatus> mapping : mappings) {
            table.putIfAbsent(mapping.getKey(), mapping.getValue());
        }
        addRule(name, InversionRule.mapping(table));
    }

    /**
     * Check that a rule name can be applied
     *
     * @throws UnknownInversionRuleException if no rule is registered under the name
     */
    public void validateRule(String name) {
        if (!hasRule(name)) {
            throw new UnknownInversionRuleException(name);
        }
    }

    /**
     * Apply a named rule to a copy of the result
     *
     * @param ruleName rule name; null or {@code none} returns the input unchanged
     * @return the inverted copy carrying the original status and message in its data
     * @throws UnknownInversionRuleException if no rule is registered under the name
     */
    public ProbeResult applyInversion(ProbeResult result, String ruleName) {
        if (isNone(ruleName)) {
            return result;
        }

        InversionRule rule = rules.get(ruleName);
        if (rule == null) {
            throw new UnknownInversionRuleException(ruleName);
        }

        ResultStatus original = result.getStatus();
        ResultStatus inverted = rule.apply(original);
        if (inverted == null) {
            throw new IllegalStateException("Inversion rule " + ruleName + " returned no status for " + original);
        }

        ProbeResult copy = result.copy();
        copy.setStatus(inverted);

        String note = original == inverted
            ? "[Inversion: " + ruleName + " - no change]"
            : "[Inverted: " + original.value() + " → " + inverted.value() + " via " + ruleName + "]";
        String message = result.getMessage();
        copy.setMessage(message != null && !message.isEmpty() ? message + " " + note : note);

        copy.addData("original_status", original.value());
        copy.addData("original_message", message);
        copy.addData("inversion_applied", ruleName);

        if (original != inverted) {
            log.debug("Inverted {} result of {} to {} via {}", original, result.getProbeName(), inverted, ruleName);
        }
        return copy;
    }

    /**
     * Apply a rule only when the result meets all conditions
     *
     * @throws UnknownInversionRuleException if no rule is registered under the name, whether or not the conditions match
     */
    public ProbeResult applyConditionalInversion(ProbeResult result, InversionConditions conditions, String ruleName) {
        if (!isNone(ruleName)) {
            validateRule(ruleName);
        }
        if (conditions != null && !conditions.matches(result)) {
            return result;
        }
        return applyInversion(result, ruleName);
    }

    /**
     * Apply rules in sequence, each to the previous rule's output
     */
    public ProbeResult applyMultipleInversions(ProbeResult result, List<String> ruleNames) {
        ProbeResult current = result;
        for (String ruleName : ruleNames) {
            current = applyInversion(current, ruleName);
        }
        return current;
    }

    public Map<String, ProbeResult> batchApplyInversions(Map<String, ProbeResult> results, String ruleName) {
        validateRule(ruleName);
        Map<String, ProbeResult> inverted = new LinkedHashMap<>();
        results.forEach((key, result) -> inverted.put(key, applyInversion(result, ruleName)));
        return inverted;
    }

    /**
     * Pick a rule from the probe name and context
     *
     * @return rule name, {@code none} when no rule fits
     */
    public String determineSmartInversion(ProbeResult result, Map<String, Object> context) {
        String name = result.getProbeName() != null ? result.getProbeName().toLowerCase(Locale.ROOT) : "";

        if (name.contains("vulnerability") || name.contains("exploit") || name.contains("malware")) {
            return SECURITY_INVERTED;
        }

        Object complianceMode = context != null ? context.get("compliance_mode") : null;
        if (complianceMode != null) {
            return "strict".equals(complianceMode) ? COMPLIANCE_STRICT : COMPLIANCE_LENIENT;
        }

        if (name.contains("availability") || name.contains("uptime") || name.contains("response_time")) {
            return AVAILABILITY_INVERTED;
        }
        return NONE;
    }

    public ProbeResult applySmartInversion(ProbeResult result, Map<String, Object> context) {
        return applyInversion(result, determineSmartInversion(result, context));
    }

    public InversionStatistics getInversionStatistics(Collection<ProbeResult> results) {
        Map<String, Long> changes = new TreeMap<>();
        Map<String, Long> modes = new TreeMap<>();
        int applied = 0;

        for (ProbeResult result : results) {
            Object mode = result.getData().get("inversion_applied");
            if (mode == null) {
                continue;
            }
            applied++;
            modes.merge(mode.toString(), 1L, Long::sum);

            Object original = result.getData().get("original_status");
            if (original != null) {
                changes.merge(original + "_to_" + result.getStatus().value(), 1L, Long::sum);
            }
        }

        return InversionStatistics.builder()
            .totalResults(results.size())
            .inversionsApplied(applied)
            .statusChanges(changes)
            .modesUsed(modes)
            .build();
    }

    /**
     * Check the registry for missing required rules and rules that fail on a sample status
     *
     * @return human readable issues, empty when the configuration is valid
     */
    public List<String> validateConfiguration() {
        List<String> issues = new ArrayList<>();
        for (String required : REQUIRED_RULES) {
            if (!rules.containsKey(required)) {
                issues.add("Missing required inversion rule: " + required);
            }
        }

        rules.forEach((name, rule) -> {
            for (ResultStatus status : ResultStatus.values()) {
                try {
                    if (rule.apply(status) == null) {
                        issues.add("Invalid inversion rule '" + name + "': no status for " + status.value());
                        return;
                    }
                } catch (RuntimeException e) {
                    issues.add("Invalid inversion rule '" + name + "': " + e.getMessage());
                    return;
                }
            }
        });
        return issues;
    }

    /**
     * Drop custom rules and restore the built-in ones
     */
    public void resetToDefaults() {
        rules.clear();
        registerDefaultRules();
    }

    private static boolean isNone(String ruleName) {
        return ruleName == null || ruleName.isBlank() || NONE.equals(ruleName);
    }
}
