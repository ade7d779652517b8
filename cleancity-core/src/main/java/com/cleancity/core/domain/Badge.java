package com.cleancity.core.domain;

/**
 * Citizen badge ladder, ordered by point threshold.
 */
public enum Badge {
    CLEANLINESS_ROOKIE("Cleanliness Rookie", 0),
    ECO_WARRIOR("Eco Warrior", 50),
    COMMUNITY_CHAMPION("Community Champion", 200),
    CLEANUP_LEGEND("Cleanup Legend", 500);

    private final String displayName;
    private final int threshold;

    Badge(String displayName, int threshold) {
        this.displayName = displayName;
        this.threshold = threshold;
    }

    public String getDisplayName() { return displayName; }
    public int getThreshold() { return threshold; }

    public static Badge forPoints(int points) {
        Badge[] ladder = values();
        for (int i = ladder.length - 1; i >= 0; i--) {
            if (points >= ladder[i].threshold) {
                return ladder[i];
            }
        }
        return CLEANLINESS_ROOKIE;
    }

    /**
     * The higher of the two rungs; badges never move down the ladder.
     */
    public Badge atLeast(Badge other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
