package com.railplan.oracle;

import java.util.ArrayList;
import java.util.List;

/** One train's proposed change in an oracle response. */
public class OracleResolution {

    public String trainId;

    /** Signed departure shift in minutes. */
    public double timeAdjustmentMin;

    /** Additional dwell in minutes per stop, aligned with the train's stops. */
    public List<Double> dwellDelays = new ArrayList<>();

    /** Suggested platform, advisory only. */
    public String trackAssignment;

    /** Between zero and one. */
    public double confidence;

}
