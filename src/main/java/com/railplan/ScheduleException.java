package com.railplan;

import com.railplan.common.ExceptionUtils;

/**
 * The single exception type thrown by the scheduling engine. The Type field lets callers distinguish failures that
 * concern a single train (which are isolated and reported) from failures of the whole request.
 */
public class ScheduleException extends RuntimeException {

    public final Type type;

    public enum Type {
        /** Travel time requested with non-positive acceleration, deceleration or speed. */
        INVALID_KINEMATICS,
        /** Two consecutive stops of a route are not connected in the network. */
        UNREACHABLE_STOP,
        /** The external optimization oracle failed, timed out or answered with something unusable. */
        ORACLE_UNAVAILABLE,
        /** Malformed input, rejected before any computation. */
        BAD_INPUT,
        CONFIGURATION
    }

    public static ScheduleException invalidKinematics (String message) {
        return new ScheduleException(Type.INVALID_KINEMATICS, message, null);
    }

    public static ScheduleException unreachableStop (String trainId, String fromStationId, String toStationId) {
        return new ScheduleException(Type.UNREACHABLE_STOP, String.format(
                "Train %s: no path from station %s to station %s.", trainId, fromStationId, toStationId), null);
    }

    public static ScheduleException oracleUnavailable (String message) {
        return new ScheduleException(Type.ORACLE_UNAVAILABLE, message, null);
    }

    public static ScheduleException oracleUnavailable (String message, Throwable cause) {
        return new ScheduleException(Type.ORACLE_UNAVAILABLE,
                message + ": " + ExceptionUtils.shortCauseString(cause), cause);
    }

    public static ScheduleException badInput (String message) {
        return new ScheduleException(Type.BAD_INPUT, message, null);
    }

    public static ScheduleException configuration (String message) {
        return new ScheduleException(Type.CONFIGURATION, message, null);
    }

    public ScheduleException (Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

}
