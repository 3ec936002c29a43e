package com.boardroom.sim.situation;

import java.util.List;

/**
 * Ids of the built-in situations. The generic trigger pools and follow-up
 * crisis pools refer to these, so every catalog must define them.
 */
public final class SituationIds {

    public static final String UNION_ORGANIZING = "SIT_UNION_ORGANIZING";
    public static final String KEY_PERFORMER_QUITS = "SIT_KEY_PERFORMER_QUITS";
    public static final String REVIEW_SITE_BACKLASH = "SIT_REVIEW_SITE_BACKLASH";
    public static final String PRIVACY_INVESTIGATION = "SIT_PRIVACY_INVESTIGATION";
    public static final String DATA_MIGRATION_DISASTER = "SIT_DATA_MIGRATION_DISASTER";
    public static final String SECURITY_VULNERABILITY = "SIT_SECURITY_VULNERABILITY";
    public static final String PRESS_RECOGNITION = "SIT_PRESS_RECOGNITION";
    public static final String ENGAGEMENT_BOOST = "SIT_ENGAGEMENT_BOOST";
    public static final String MASS_RESIGNATION = "SIT_MASS_RESIGNATION";

    /** Situations referenced directly by the resolvers. */
    public static final List<String> REQUIRED = List.of(
        KEY_PERFORMER_QUITS, REVIEW_SITE_BACKLASH, SECURITY_VULNERABILITY,
        PRESS_RECOGNITION, ENGAGEMENT_BOOST);

    private SituationIds() { /* utility class */ }
}
