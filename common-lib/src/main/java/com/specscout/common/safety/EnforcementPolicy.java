package com.specscout.common.safety;

import com.specscout.common.model.Recommendation;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Computes the process exit status of a run from its recommendations alone.
 *
 * <p>Non-zero iff enforcement is enabled and at least one recommendation is both
 * actionable and high confidence. Stateless.
 */
public final class EnforcementPolicy {

    public static final int SUCCESS_EXIT_STATUS = 0;
    public static final int FAILURE_EXIT_STATUS = 1;

    private EnforcementPolicy() {}

    public static int exitStatus(Collection<Recommendation> recommendations, boolean enforcementEnabled) {
        return evaluate(recommendations, enforcementEnabled).exitStatus();
    }

    public static EnforcementOutcome evaluate(Collection<Recommendation> recommendations,
                                              AnalysisConfig config) {
        return evaluate(recommendations, config.enforcementMode());
    }

    public static EnforcementOutcome evaluate(Collection<Recommendation> recommendations,
                                              boolean enforcementEnabled) {
        if (!enforcementEnabled) {
            return new EnforcementOutcome(SUCCESS_EXIT_STATUS, List.of(), "Enforcement disabled");
        }
        List<Recommendation> qualifying = recommendations == null ? List.of()
            : recommendations.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.actionable() && r.highConfidence())
                .toList();
        if (qualifying.isEmpty()) {
            return new EnforcementOutcome(SUCCESS_EXIT_STATUS, qualifying,
                "No high confidence recommendations found");
        }
        StringBuilder message = new StringBuilder()
            .append(qualifying.size()).append(" high confidence recommendation(s) require action:");
        for (Recommendation r : qualifying) {
            message.append(System.lineSeparator())
                .append("  ").append(r.specLocation()).append(": ")
                .append(r.action().value()).append(' ')
                .append(r.fromValue()).append(" -> ").append(r.toValue());
        }
        return new EnforcementOutcome(FAILURE_EXIT_STATUS, qualifying, message.toString());
    }
}
