package com.tribrid.studio.telemetry;

/**
 * Interface for metric event deduplication.
 *
 * Tracks the structural keys of every event applied to the retained window.
 * A key that has been marked is rejected until {@link #clear()}.
 */
public interface EventDeduplicator {

    /**
     * Checks whether a key has not been applied yet.
     *
     * @param key the structural key (see MetricEventKeys)
     * @return true if the key is not in the set
     */
    boolean isNew(String key);

    /**
     * Records a key as applied.
     *
     * @param key the structural key
     */
    void mark(String key);

    /**
     * Forgets every key. Called by the owning consumer on run switch and when
     * the retained window is rebuilt after truncation.
     */
    void clear();

    /**
     * Gets the number of tracked keys.
     *
     * @return count of keys
     */
    int size();
}
