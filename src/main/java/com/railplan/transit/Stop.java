package com.railplan.transit;

/**
 * One call of a train at a station. Arrival and departure are computed by the TimetablePropagator; the planned
 * fields are optional operator pins that the propagator must respect.
 */
public class Stop implements Cloneable {

    public String stationId;

    /** Assigned platform or track at the station, or null when not assigned. */
    public String track;

    /** Minimum dwell time in minutes. */
    public int minDwellMinutes;

    /** Additional dwell in minutes added by conflict resolution. Reset before each full resolution cycle. */
    public double extraDwellMinutes;

    /** A skipped stop is passed through without stopping: no dwell and no platform occupation. */
    public boolean skipped;

    /** Computed arrival in seconds after the reference midnight, null at the origin. */
    public Integer arrival;

    /** Computed departure in seconds after the reference midnight, null at the terminus. */
    public Integer departure;

    public Integer plannedArrival;

    public Integer plannedDeparture;

    public Stop () { }

    public Stop (String stationId, int minDwellMinutes) {
        this.stationId = stationId;
        this.minDwellMinutes = minDwellMinutes;
    }

    /** Total dwell in minutes that the propagator applies at this stop. */
    public double dwellMinutes () {
        return skipped ? 0 : minDwellMinutes + extraDwellMinutes;
    }

    @Override
    public Stop clone () {
        try {
            return (Stop) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public String toString () {
        return String.format("Stop at %s%s (dwell %d+%.1f min)", stationId, skipped ? " [skipped]" : "",
                minDwellMinutes, extraDwellMinutes);
    }

}
