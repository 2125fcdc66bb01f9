package com.railplan.conflict;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable summaries of a set of conflicts, used in logs and pipeline results.
 */
public abstract class ConflictReport {

    /** Number of conflicts per location, most congested first. */
    public static Map<String, Integer> hotspots (Collection<Conflict> conflicts) {
        Multiset<String> counts = HashMultiset.create();
        for (Conflict conflict : conflicts) {
            counts.add(conflict.locationId);
        }
        Map<String, Integer> hotspots = new LinkedHashMap<>();
        for (Multiset.Entry<String> entry : Multisets.copyHighestCountFirst(counts).entrySet()) {
            hotspots.put(entry.getElement(), entry.getCount());
        }
        return hotspots;
    }

    /** The first n conflicts in processing order. */
    public static List<Conflict> preview (Collection<Conflict> conflicts, int n) {
        List<Conflict> sorted = new ArrayList<>(conflicts);
        sorted.sort(Conflict.ORDER);
        return new ArrayList<>(sorted.subList(0, Math.min(n, sorted.size())));
    }

    /** A multi-line text report listing up to the given number of conflicts and the busiest locations. */
    public static String format (Collection<Conflict> conflicts, int limit) {
        if (conflicts.isEmpty()) {
            return "No conflicts.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(conflicts.size()).append(" conflicts");
        for (Conflict conflict : preview(conflicts, limit)) {
            sb.append("\n  ").append(conflict);
        }
        if (conflicts.size() > limit) {
            sb.append("\n  ... and ").append(conflicts.size() - limit).append(" more");
        }
        sb.append("\nHotspots:");
        int n = 0;
        for (Map.Entry<String, Integer> hotspot : hotspots(conflicts).entrySet()) {
            if (n++ >= limit) break;
            sb.append("\n  ").append(hotspot.getKey()).append(": ").append(hotspot.getValue());
        }
        return sb.toString();
    }

}
