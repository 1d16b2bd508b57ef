package com.specscout.analysis.indicator;

import com.specscout.common.model.EventExample;
import com.specscout.common.model.EventStats;
import com.specscout.common.model.FactoryUsage;
import com.specscout.common.model.ProfileRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure signal extraction over a {@link ProfileRecord}, shared by the rule-based agents.
 * Event and factory iteration follows the profile's map order, so results are deterministic.
 */
public final class ProfileIndicators {

    /** Metadata keys under which the normalizer records profiler subsystem failures. */
    public static final String FACTORY_PROF_ERROR = "factory_prof_error";
    public static final String EVENT_PROF_ERROR   = "event_prof_error";
    public static final String DB_QUERIES_ERROR   = "db_queries_error";

    private static final Pattern COMMIT_PATTERN = Pattern.compile("commit");

    private static final Pattern CALLBACK_EVENT_PATTERN =
        Pattern.compile("callback|\\b(after|before|around)_[a-z_]+");

    // Whole name segments only: '.', '_' and other punctuation separate segments.
    private static final Pattern CROSS_BOUNDARY_PATTERN = Pattern.compile(
        "(?<![a-z0-9])(request|controller|action_dispatch|action_view|render|routing|rack|http|faraday|capybara)"
            + "(?![a-z0-9])");

    private ProfileIndicators() {}

    // ── factories ───────────────────────────────────────────────────────────

    /** Factories using the create strategy with a positive count, in profile order. */
    public static Map<String, FactoryUsage> createdFactories(ProfileRecord profile) {
        Map<String, FactoryUsage> created = new LinkedHashMap<>();
        profile.factories().forEach((name, usage) -> {
            if (usage.persisted()) created.put(name, usage);
        });
        return created;
    }

    public static int totalCount(Collection<FactoryUsage> usages) {
        return usages.stream().mapToInt(FactoryUsage::count).sum();
    }

    /** Highest-count entry; the first one wins a tie. */
    public static Optional<Map.Entry<String, FactoryUsage>> dominant(Map<String, FactoryUsage> factories) {
        Map.Entry<String, FactoryUsage> best = null;
        for (Map.Entry<String, FactoryUsage> entry : factories.entrySet()) {
            if (best == null || entry.getValue().count() > best.getValue().count()) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Table names a factory plausibly persists to: {@code user → user, users}, {@code company → companies}. */
    public static Set<String> tableNamesFor(String factoryName) {
        String name = factoryName.toLowerCase(Locale.ROOT);
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        if (name.endsWith("y") && name.length() > 1) {
            names.add(name.substring(0, name.length() - 1) + "ies");
        } else if (name.endsWith("s") || name.endsWith("x") || name.endsWith("ch") || name.endsWith("sh")) {
            names.add(name + "es");
        } else {
            names.add(name + "s");
        }
        return names;
    }

    // ── events ──────────────────────────────────────────────────────────────

    /**
     * Events showing a persisted record of {@code factoryName} being read back: a reload event
     * mentioning the factory (or carrying no samples at all), or a primary-key SELECT on one of
     * its tables.
     */
    public static List<String> reloadEventsFor(ProfileRecord profile, String factoryName) {
        Set<String> tables = tableNamesFor(factoryName);
        List<Pattern> keyedSelects = tables.stream().map(ProfileIndicators::keyedSelectPattern).toList();
        List<String> matches = new ArrayList<>();
        profile.events().forEach((eventName, stats) -> {
            boolean reloadEvent = eventName.toLowerCase(Locale.ROOT).contains("reload");
            if (reloadEvent && stats.examples().isEmpty()) {
                matches.add(eventName);
                return;
            }
            for (EventExample example : stats.examples()) {
                String text = unquote(example.searchableText());
                boolean mentions = tables.stream().anyMatch(text::contains);
                boolean keyed = keyedSelects.stream().anyMatch(p -> p.matcher(text).find());
                if ((reloadEvent && mentions) || keyed) {
                    matches.add(eventName);
                    return;
                }
            }
        });
        return matches;
    }

    /** Events whose name or samples refer to a commit (after_commit callbacks, commit-dependent reads). */
    public static List<String> commitDependentEvents(ProfileRecord profile) {
        return matchingEvents(profile, COMMIT_PATTERN, true);
    }

    /** Events named after model callbacks, e.g. {@code after_save.callbacks}. */
    public static List<String> callbackEvents(ProfileRecord profile) {
        return matchingEvents(profile, CALLBACK_EVENT_PATTERN, false);
    }

    /** Events crossing a process boundary: controller dispatch, rendering, HTTP. */
    public static List<String> crossBoundaryEvents(ProfileRecord profile) {
        return matchingEvents(profile, CROSS_BOUNDARY_PATTERN, false);
    }

    // ── metadata ────────────────────────────────────────────────────────────

    /** A metadata value counts as set when it is true, non-zero, or a non-empty string/collection/map. */
    public static boolean flagSet(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return !s.toString().isBlank() && !"false".equalsIgnoreCase(s.toString());
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    public static Optional<String> profilerError(ProfileRecord profile, String key) {
        return flagSet(profile.metadata(), key)
            ? Optional.of(String.valueOf(profile.metadata().get(key)))
            : Optional.empty();
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static List<String> matchingEvents(ProfileRecord profile, Pattern pattern, boolean includeSamples) {
        List<String> matches = new ArrayList<>();
        for (Map.Entry<String, EventStats> entry : profile.events().entrySet()) {
            if (pattern.matcher(entry.getKey().toLowerCase(Locale.ROOT)).find()) {
                matches.add(entry.getKey());
                continue;
            }
            if (includeSamples && entry.getValue().examples().stream()
                    .anyMatch(e -> pattern.matcher(e.searchableText()).find())) {
                matches.add(entry.getKey());
            }
        }
        return matches;
    }

    private static Pattern keyedSelectPattern(String table) {
        String t = Pattern.quote(table);
        return Pattern.compile("\\bselect\\b.*\\bfrom\\s+" + t + "\\b.*\\bwhere\\b.*?(\\b" + t + "\\.)?\\bid\\s*(=|in\\b)");
    }

    private static String unquote(String sql) {
        return sql.replace("\"", "").replace("`", "");
    }
}
