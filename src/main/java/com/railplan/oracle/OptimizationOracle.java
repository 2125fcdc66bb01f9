package com.railplan.oracle;

import com.railplan.ScheduleException;

/**
 * An external service proposing conflict resolutions for a timetable snapshot. Its proposals are advisory: the
 * pipeline filters them by confidence and verifies them before keeping anything.
 */
public interface OptimizationOracle {

    /**
     * @throws ScheduleException of type ORACLE_UNAVAILABLE if no usable answer can be obtained.
     */
    OracleResponse optimize (OracleRequest request);

}
