package com.proveground.matchengine.signal;

import java.util.Locale;

/**
 * The closed set of signals a match score is built from. Evaluation and
 * breakdown order follow declaration order.
 */
public enum SignalType {

    /**
     * Share of the listing's required skills the student already has.
     */
    SKILLS("Skills Alignment"),

    /**
     * Free weekly hours over the listing's duration against its required hours.
     */
    TEMPORAL("Temporal Fit"),

    /**
     * Workload balance: existing engagements, concurrent projects and sport load.
     */
    SUSTAINABILITY("Sustainability"),

    /**
     * Whether the listing stretches the student in a direction they care about.
     */
    GROWTH("Growth Trajectory"),

    /**
     * Track record: completion, punctuality, ratings and tenure.
     */
    TRUST("Trust / Reliability"),

    /**
     * Same tenant or shared partner network between student and listing owner.
     */
    NETWORK("Network Affinity");

    private final String displayName;

    SignalType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Key used in the stored breakdown and in configuration, e.g. "skills".
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
