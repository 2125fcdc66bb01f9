package com.railplan.oracle;

import java.util.ArrayList;
import java.util.List;

/** The answer of the optimization oracle. */
public class OracleResponse {

    public boolean success;

    public List<OracleResolution> resolutions = new ArrayList<>();

    /** Overall confidence reported by the oracle, if any. */
    public Double mlConfidence;

    public double totalDelayMinutes;

    public double inferenceTimeMs;

    public int conflictsDetected;

    public int conflictsResolved;

    public String errorMessage;

    /**
     * The confidence used to decide whether to apply the response: the overall confidence if reported, otherwise the
     * mean confidence of the individual resolutions. Zero when there is nothing to go on.
     */
    public double averageConfidence () {
        if (mlConfidence != null) {
            return mlConfidence;
        }
        if (resolutions == null || resolutions.isEmpty()) {
            return 0;
        }
        return resolutions.stream().mapToDouble(r -> r.confidence).average().orElse(0);
    }

}
