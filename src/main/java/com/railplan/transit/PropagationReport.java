package com.railplan.transit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Timetables of all the trains that could be propagated, and the reason for each one that could not.
 * A failing train does not prevent the others from being scheduled.
 */
public class PropagationReport {

    /** Keyed on train ID, in input order. */
    public final Map<String, Timetable> timetables = new LinkedHashMap<>();

    /** Keyed on train ID, the message of the error that prevented propagation. */
    public final Map<String, String> failures = new LinkedHashMap<>();

    public Collection<Timetable> timetables () {
        return timetables.values();
    }

    public List<Timetable> timetableList () {
        return new ArrayList<>(timetables.values());
    }

    public boolean hasFailures () {
        return !failures.isEmpty();
    }

}
