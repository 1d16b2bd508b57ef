package com.specscout.analysis;

import com.specscout.common.model.DbStats;
import com.specscout.common.model.EventExample;
import com.specscout.common.model.EventStats;
import com.specscout.common.model.FactoryStrategy;
import com.specscout.common.model.FactoryUsage;
import com.specscout.common.model.ProfileRecord;
import com.specscout.common.model.SpecType;

/** Profiles shared by the agent, service and controller tests. */
public final class ProfileFixtures {

    public static final String MODEL_LOCATION = "spec/models/user_spec.rb:10";
    public static final String SYSTEM_LOCATION = "spec/system/checkout_spec.rb:5";

    private ProfileFixtures() {}

    /** Model spec creating three users whose records are never read back. */
    public static ProfileRecord modelSpecCreatingUsers() {
        return ProfileRecord.of(MODEL_LOCATION)
            .withRuntimeMs(8.0)
            .withFactory("user", FactoryUsage.of(FactoryStrategy.CREATE, 3))
            .withDb(new DbStats(8, 3, 5, 0, 0));
    }

    /** Same spec, but an after_commit callback fires. */
    public static ProfileRecord modelSpecWithCommitCallback() {
        return modelSpecCreatingUsers()
            .withEvent("after_commit.callbacks", EventStats.of(1));
    }

    /** Browser-driven spec with no writes: database says optimize, intent says integration. */
    public static ProfileRecord systemSpecWithoutWrites() {
        return ProfileRecord.of(SYSTEM_LOCATION)
            .withRuntimeMs(450.0)
            .withDb(new DbStats(4, 0, 4, 0, 0))
            .withEvent("process_action.action_controller", EventStats.of(2))
            .withEvent("render_template.action_view", EventStats.of(2));
    }

    /** Model spec that reloads the created user by primary key. */
    public static ProfileRecord modelSpecReloadingUser() {
        return modelSpecCreatingUsers()
            .withEvent("sql.active_record", EventStats.of(5,
                EventExample.ofSql("SELECT \"users\".* FROM \"users\" WHERE \"users\".\"id\" = $1 LIMIT $2")));
    }

    /** Scenario without a location: spec type comes only from the explicit field. */
    public static ProfileRecord unlocatedModelSpecCreatingUsers() {
        return ProfileRecord.of("")
            .withSpecType(SpecType.MODEL)
            .withFactory("user", FactoryUsage.of(FactoryStrategy.CREATE, 3))
            .withDb(new DbStats(8, 3, 5, 0, 0));
    }

    /** System spec without a location that creates users and dispatches a controller action. */
    public static ProfileRecord unlocatedSystemSpecCreatingUsers() {
        return ProfileRecord.of("")
            .withSpecType(SpecType.SYSTEM)
            .withFactory("user", FactoryUsage.of(FactoryStrategy.CREATE, 3))
            .withDb(new DbStats(5, 0, 5, 0, 0))
            .withEvent("process_action.action_controller", EventStats.of(1));
    }
}
