package com.specscout.analysis.indicator;

import com.specscout.analysis.ProfileFixtures;
import com.specscout.common.model.EventExample;
import com.specscout.common.model.EventStats;
import com.specscout.common.model.FactoryStrategy;
import com.specscout.common.model.FactoryUsage;
import com.specscout.common.model.ProfileRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProfileIndicatorsTest {

    @Nested
    @DisplayName("factories")
    class Factories {

        @Test
        @DisplayName("table names cover regular and y-ending plurals")
        void tableNames() {
            assertEquals(Set.of("user", "users"), ProfileIndicators.tableNamesFor("user"));
            assertEquals(Set.of("company", "companies"), ProfileIndicators.tableNamesFor("Company"));
            assertEquals(Set.of("address", "addresses"), ProfileIndicators.tableNamesFor("address"));
        }

        @Test
        @DisplayName("dominant factory is the highest count, first on ties")
        void dominant() {
            ProfileRecord profile = ProfileRecord.of("spec/models/a_spec.rb:1")
                .withFactory("post", FactoryUsage.of(FactoryStrategy.CREATE, 2))
                .withFactory("user", FactoryUsage.of(FactoryStrategy.CREATE, 2))
                .withFactory("tag", FactoryUsage.of(FactoryStrategy.BUILD, 9));
            Map<String, FactoryUsage> created = ProfileIndicators.createdFactories(profile);

            assertEquals(List.of("post", "user"), List.copyOf(created.keySet()));
            assertEquals("post", ProfileIndicators.dominant(created).orElseThrow().getKey());
        }
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        @DisplayName("primary-key select on the factory table is a reload")
        void keyedSelect() {
            assertEquals(List.of("sql.active_record"),
                ProfileIndicators.reloadEventsFor(ProfileFixtures.modelSpecReloadingUser(), "user"));
        }

        @Test
        @DisplayName("foreign-key select is not a reload")
        void foreignKeySelect() {
            ProfileRecord profile = ProfileFixtures.modelSpecCreatingUsers()
                .withEvent("sql.active_record", EventStats.of(1,
                    EventExample.ofSql("SELECT * FROM posts WHERE posts.user_id = 1")));
            assertTrue(ProfileIndicators.reloadEventsFor(profile, "user").isEmpty());
        }

        @Test
        @DisplayName("reload event without samples applies to every factory")
        void unsampledReload() {
            ProfileRecord profile = ProfileFixtures.modelSpecCreatingUsers()
                .withEvent("instance.reload", EventStats.of(1));
            assertEquals(List.of("instance.reload"), ProfileIndicators.reloadEventsFor(profile, "user"));
        }

        @Test
        @DisplayName("commit is detected in event names and in samples")
        void commitEvents() {
            ProfileRecord profile = ProfileRecord.of("spec/models/a_spec.rb:1")
                .withEvent("after_commit.callbacks", EventStats.of(1))
                .withEvent("sql.active_record", EventStats.of(1, EventExample.ofSql("COMMIT")))
                .withEvent("cache.read", EventStats.of(1));
            assertEquals(List.of("after_commit.callbacks", "sql.active_record"),
                ProfileIndicators.commitDependentEvents(profile));
        }

        @Test
        @DisplayName("controller and view events cross a boundary")
        void crossBoundary() {
            assertEquals(List.of("process_action.action_controller", "render_template.action_view"),
                ProfileIndicators.crossBoundaryEvents(ProfileFixtures.systemSpecWithoutWrites()));
        }

        @Test
        @DisplayName("boundary keywords inside longer words do not count")
        void crossBoundaryNeedsWholeSegment() {
            ProfileRecord profile = ProfileRecord.of(ProfileFixtures.MODEL_LOCATION)
                .withEvent("analytics.track", EventStats.of(1))
                .withEvent("surrender.game", EventStats.of(1))
                .withEvent("httpx_retry.worker", EventStats.of(1))
                .withEvent("request.action_dispatch", EventStats.of(1))
                .withEvent("rack.attack", EventStats.of(1));
            assertEquals(List.of("request.action_dispatch", "rack.attack"),
                ProfileIndicators.crossBoundaryEvents(profile));
        }
    }

    @Test
    @DisplayName("metadata flags honour value truthiness")
    void flags() {
        Map<String, Object> metadata = Map.of(
            "a", true, "b", false, "c", 0, "d", 2, "e", "", "f", List.of(), "g", List.of("x"), "h", "false");
        assertTrue(ProfileIndicators.flagSet(metadata, "a"));
        assertFalse(ProfileIndicators.flagSet(metadata, "b"));
        assertFalse(ProfileIndicators.flagSet(metadata, "c"));
        assertTrue(ProfileIndicators.flagSet(metadata, "d"));
        assertFalse(ProfileIndicators.flagSet(metadata, "e"));
        assertFalse(ProfileIndicators.flagSet(metadata, "f"));
        assertTrue(ProfileIndicators.flagSet(metadata, "g"));
        assertFalse(ProfileIndicators.flagSet(metadata, "h"));
        assertFalse(ProfileIndicators.flagSet(metadata, "missing"));
    }
}
