package com.railplan.network;

import com.railplan.ScheduleException;

/**
 * A node of the railway network where trains can stop.
 */
public class Station {

    public final String id;

    public final String name;

    public final StationType type;

    /** Number of platforms trains can be assigned to, or zero when unknown. */
    public final int platforms;

    public Station (String id, String name, StationType type, int platforms) {
        if (id == null || id.isEmpty()) {
            throw ScheduleException.badInput("Station must have an ID.");
        }
        if (platforms < 0) {
            throw ScheduleException.badInput("Station " + id + " has a negative number of platforms.");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.type = type == null ? StationType.STATION : type;
        this.platforms = platforms;
    }

    public Station (String id, String name) {
        this(id, name, StationType.STATION, 0);
    }

    @Override
    public String toString () {
        return String.format("Station %s (%s, %d platforms)", id, name, platforms);
    }

}
