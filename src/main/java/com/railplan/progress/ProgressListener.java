package com.railplan.progress;

/**
 * This interface provides simple callbacks to allow long running operations such as the population optimizer to
 * report on their progress. Take care that all method implementations are very fast as the increment methods might be
 * called in tight loops.
 */
public interface ProgressListener {

    /**
     * Call this method once at the beginning of a new task, specifying how many sub-units of work will be performed.
     * If totalElements is zero or negative, any previously set total number of elements remains unchanged.
     */
    void beginTask(String description, int totalElements);

    /** Call this method to report that N units of work have been performed. */
    void increment(int n);

    /** Call this method to report that one unit of work has been performed. */
    default void increment () {
        increment(1);
    }

    /** A listener that ignores all progress, for callers that do not track it. */
    ProgressListener NONE = new ProgressListener() {
        @Override
        public void beginTask (String description, int totalElements) { }

        @Override
        public void increment (int n) { }
    };

}
