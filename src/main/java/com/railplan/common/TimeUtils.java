package com.railplan.common;

/**
 * Schedule times are integer seconds after the reference midnight. Times past midnight continue to count up
 * (e.g. 25:10 is 90600) so that a service running over midnight keeps increasing times.
 */
public abstract class TimeUtils {

    public static final int SECONDS_PER_DAY = 24 * 60 * 60;

    /** Reduce a time to the time of day on the reference day. */
    public static int timeOfDay (int seconds) {
        return Math.floorMod(seconds, SECONDS_PER_DAY);
    }

    public static int minutesToSeconds (double minutes) {
        return (int) Math.round(minutes * 60);
    }

    public static int hms (int hours, int minutes, int seconds) {
        return hours * 3600 + minutes * 60 + seconds;
    }

    /** Format as HH:MM:SS. Negative times are prefixed with a minus sign. */
    public static String format (Integer seconds) {
        if (seconds == null) return "--:--:--";
        int s = Math.abs(seconds);
        String formatted = String.format("%02d:%02d:%02d", s / 3600, (s / 60) % 60, s % 60);
        return seconds < 0 ? "-" + formatted : formatted;
    }

}
