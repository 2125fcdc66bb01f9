package com.railplan.schedule;

import com.google.common.collect.Lists;
import com.railplan.transit.Stop;
import com.railplan.transit.TrainCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * The pattern shared by all trains of a cadenced service: stopping pattern, performance and numbering.
 */
public class ServiceTemplate {

    public String lineId;

    /** Used as the prefix of generated train names. */
    public String lineName;

    public TrainCategory category = TrainCategory.REGIONAL;

    public int priority = 5;

    /** Zero to use the category default. */
    public double maxSpeedKmh;

    public double acceleration = 0.5;

    public double deceleration = 0.5;

    /** Train number of the first outward train. Outward trains get even offsets, return trains odd ones. */
    public int startNumber = 1000;

    public List<Stop> stops = new ArrayList<>();

    public ServiceTemplate (String lineId, String lineName) {
        this.lineId = lineId;
        this.lineName = lineName;
    }

    public ServiceTemplate addStop (String stationId, int minDwellMinutes) {
        stops.add(new Stop(stationId, minDwellMinutes));
        return this;
    }

    public double effectiveMaxSpeedKmh () {
        return maxSpeedKmh > 0 ? maxSpeedKmh : category.defaultMaxSpeedKmh;
    }

    /** The same service in the opposite direction, with the stops reversed. */
    public ServiceTemplate reversed () {
        ServiceTemplate reversed = new ServiceTemplate(lineId, lineName);
        reversed.category = category;
        reversed.priority = priority;
        reversed.maxSpeedKmh = maxSpeedKmh;
        reversed.acceleration = acceleration;
        reversed.deceleration = deceleration;
        reversed.startNumber = startNumber;
        for (Stop stop : Lists.reverse(stops)) {
            Stop copy = stop.clone();
            copy.arrival = null;
            copy.departure = null;
            copy.plannedArrival = null;
            copy.plannedDeparture = null;
            reversed.stops.add(copy);
        }
        return reversed;
    }

}
