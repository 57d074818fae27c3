package com.whereq.warden.inversion;

import com.whereq.warden.model.ProbeResult;
import com.whereq.warden.model.ResultStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Conditions a result has to meet before a conditional inversion applies.
 * Unset conditions always hold; all set conditions must hold.
 */
@Value
@Builder
public class InversionConditions {

    @Singular
    Set<String> probeNames;

    @Singular
    Set<ResultStatus> statuses;

    /**
     * Must be found in the target. Results without a target pass.
     */
    Pattern targetPattern;

    /**
     * The result must carry a score below this value
     */
    Integer scoreThreshold;

    /**
     * Seconds
     */
    Double executionTimeMin;

    /**
     * Seconds
     */
    Double executionTimeMax;

    /**
     * Entries the result data must contain with equal values
     */
    @Singular("dataEntry")
    Map<String, Object> dataContains;

    Predicate<ProbeResult> customCondition;

    public boolean matches(ProbeResult result) {
        if (!probeNames.isEmpty() && !probeNames.contains(result.getProbeName())) {
            return false;
        }
        if (!statuses.isEmpty() && !statuses.contains(result.getStatus())) {
            return false;
        }
        if (targetPattern != null && result.getTarget() != null
                && !targetPattern.matcher(result.getTarget()).find()) {
            return false;
        }
        if (scoreThreshold != null && (result.getScore() == null || result.getScore() >= scoreThreshold)) {
            return false;
        }
        if (executionTimeMin != null && result.getExecutionTime() < executionTimeMin) {
            return false;
        }
        if (executionTimeMax != null && result.getExecutionTime() > executionTimeMax) {
            return false;
        }
        for (Map.Entry<String, Object> entry : dataContains.entrySet()) {
            if (!result.getData().containsKey(entry.getKey())
                    || !Objects.equals(result.getData().get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return customCondition == null || customCondition.test(result);
    }
}
