package com.railplan.transit;

import com.railplan.ScheduleException;

/**
 * Running time over a stretch of track under a trapezoidal speed profile: constant acceleration up to the cruise
 * speed, cruise, then constant deceleration. When the stretch is too short to reach cruise speed the profile is
 * triangular and the peak speed is found by solving the two kinematic equations together.
 *
 * All inputs use railway units (km, km/h, m/s²) and are converted to SI units internally.
 */
public abstract class TravelTimeCalculator {

    private static final double KMH_TO_MPS = 1 / 3.6;

    /** Lowest speed in m/s assumed by the degenerate-profile fallback, so the result is always finite. */
    private static final double MIN_FALLBACK_SPEED = 1.0;

    /** Travel time in hours from rest to rest. */
    public static double travelTimeHours (double distanceKm, double speedLimitKmh, Train train) {
        return travelTimeHours(distanceKm, speedLimitKmh, train, 0, 0);
    }

    /**
     * @param distanceKm length of the stretch, zero or positive.
     * @param speedLimitKmh line speed of the stretch. The train cruises at the lower of this and its own maximum.
     * @param startSpeedKmh speed when entering the stretch, clamped to the cruise speed.
     * @param endSpeedKmh speed required when leaving the stretch, clamped to the cruise speed.
     * @return travel time in hours, never negative or NaN.
     */
    public static double travelTimeHours (double distanceKm, double speedLimitKmh, Train train,
                                          double startSpeedKmh, double endSpeedKmh) {
        return travelTimeSeconds(distanceKm, speedLimitKmh, train, startSpeedKmh, endSpeedKmh) / 3600;
    }

    public static double travelTimeSeconds (double distanceKm, double speedLimitKmh, Train train,
                                            double startSpeedKmh, double endSpeedKmh) {
        checkKinematics(distanceKm, speedLimitKmh, train);
        if (distanceKm == 0) {
            return 0;
        }
        double a = train.acceleration;
        double b = train.deceleration;
        double distance = distanceKm * 1000;
        double vMax = Math.min(train.maxSpeedKmh, speedLimitKmh) * KMH_TO_MPS;
        double vStart = Math.min(Math.max(startSpeedKmh, 0) * KMH_TO_MPS, vMax);
        double vEnd = Math.min(Math.max(endSpeedKmh, 0) * KMH_TO_MPS, vMax);

        double accelDistance = (vMax * vMax - vStart * vStart) / (2 * a);
        double brakeDistance = (vMax * vMax - vEnd * vEnd) / (2 * b);

        if (accelDistance + brakeDistance <= distance) {
            double cruiseDistance = distance - accelDistance - brakeDistance;
            return (vMax - vStart) / a + cruiseDistance / vMax + (vMax - vEnd) / b;
        }

        // Cruise speed is never reached. Peak speed where the acceleration and braking curves meet.
        double peakSquared = (distance + vStart * vStart / (2 * a) + vEnd * vEnd / (2 * b))
                / (1 / (2 * a) + 1 / (2 * b));
        if (peakSquared < 0 || Math.sqrt(peakSquared) < Math.max(vStart, vEnd)) {
            // The required speed change cannot be made within the distance. Assume the average speed throughout.
            double averageSpeed = Math.max((vStart + vEnd) / 2, MIN_FALLBACK_SPEED);
            return distance / averageSpeed;
        }
        double vPeak = Math.sqrt(peakSquared);
        return (vPeak - vStart) / a + (vPeak - vEnd) / b;
    }

    private static void checkKinematics (double distanceKm, double speedLimitKmh, Train train) {
        if (!(distanceKm >= 0) || Double.isInfinite(distanceKm)) {
            throw ScheduleException.invalidKinematics("Distance must be a finite non-negative number: " + distanceKm);
        }
        if (!(speedLimitKmh > 0) || Double.isInfinite(speedLimitKmh)) {
            throw ScheduleException.invalidKinematics("Speed limit must be positive: " + speedLimitKmh);
        }
        if (!(train.maxSpeedKmh > 0) || Double.isInfinite(train.maxSpeedKmh)) {
            throw ScheduleException.invalidKinematics(
                    "Train " + train.id + " maximum speed must be positive: " + train.maxSpeedKmh);
        }
        if (!(train.acceleration > 0) || !(train.deceleration > 0)) {
            throw ScheduleException.invalidKinematics(String.format(
                    "Train %s acceleration and deceleration must be positive: %s, %s",
                    train.id, train.acceleration, train.deceleration));
        }
    }

}
