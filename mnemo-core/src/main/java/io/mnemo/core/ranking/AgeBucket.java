package io.mnemo.core.ranking;

public enum AgeBucket {
    RECENT,
    OLD;

    public static final int RECENT_WINDOW_DAYS = 180;

    public static AgeBucket of(long ageDays) {
        return ageDays < RECENT_WINDOW_DAYS ? RECENT : OLD;
    }
}
