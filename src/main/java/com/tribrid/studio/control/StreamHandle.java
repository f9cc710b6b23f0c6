package com.tribrid.studio.control;

/**
 * Handle on an open live stream.
 */
@FunctionalInterface
public interface StreamHandle extends AutoCloseable {

    /**
     * Closes the stream. Safe to call more than once.
     */
    @Override
    void close();
}
