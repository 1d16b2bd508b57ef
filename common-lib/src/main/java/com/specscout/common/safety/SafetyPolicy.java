package com.specscout.common.safety;

import com.specscout.common.exception.UnsafeConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-level safety gate. Validates configuration; never inspects or alters recommendations.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>auto-apply + enforcement mode → {@link UnsafeConfigurationException} (fatal)</li>
 *   <li>blocking mode without enforcement mode → warning (build could fail without a report)</li>
 *   <li>enforcement mode without fail-on-high-confidence → warning (not CI friendly)</li>
 * </ul>
 *
 * <p>Stateless; all methods are static.
 */
public final class SafetyPolicy {

    private static final Logger log = LoggerFactory.getLogger(SafetyPolicy.class);

    static final String AUTO_APPLY_UNDER_ENFORCEMENT =
        "auto_apply_enabled cannot be combined with enforcement_mode: "
        + "failing the build while rewriting spec sources is an unreviewable change";

    private SafetyPolicy() {}

    /** The auto-apply guard. Called by {@link AnalysisConfig}'s constructor. */
    public static void requireNoAutoApplyUnderEnforcement(boolean autoApplyEnabled, boolean enforcementMode) {
        if (autoApplyEnabled && enforcementMode) {
            throw new UnsafeConfigurationException(AUTO_APPLY_UNDER_ENFORCEMENT);
        }
    }

    /**
     * Validates a configuration before any profile is analyzed and logs non-fatal warnings.
     *
     * @throws UnsafeConfigurationException when the configuration is unsafe
     */
    public static AnalysisConfig validate(AnalysisConfig config) {
        if (config == null) {
            throw new UnsafeConfigurationException("analysis configuration is required");
        }
        requireNoAutoApplyUnderEnforcement(config.autoApplyEnabled(), config.enforcementMode());
        for (String warning : warnings(config)) {
            log.warn("[SafetyPolicy] {}", warning);
        }
        return config;
    }

    public static SafetyStatus status(AnalysisConfig config) {
        boolean safeMode = !config.autoApplyEnabled() && !config.blockingModeEnabled();
        boolean ciFriendly = !config.enforcementMode() || config.failOnHighConfidence();
        return new SafetyStatus(safeMode, !config.autoApplyEnabled(), !config.blockingModeEnabled(),
            ciFriendly, warnings(config));
    }

    static List<String> warnings(AnalysisConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config.blockingModeEnabled() && !config.enforcementMode()) {
            warnings.add("blocking_mode_enabled without enforcement_mode; builds will not be failed");
        }
        if (config.enforcementMode() && !config.failOnHighConfidence()) {
            warnings.add("enforcement_mode without fail_on_high_confidence may not be CI friendly");
        }
        if (config.autoApplyEnabled()) {
            warnings.add("auto_apply_enabled is set; recommendations are still never applied by the analyzer");
        }
        return warnings;
    }
}
