package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.MetricEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Accepted events of the selected run, oldest first, bounded in size.
 *
 * The window is allowed to overshoot its capacity by a tenth before it is
 * cut back, so the dedup set rebuild that follows a truncation costs O(1)
 * amortized per event.
 */
public class EventWindow {

    private final int capacity;
    private final int slack;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public EventWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Event window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.slack = Math.max(1, capacity / 10);
    }

    /**
     * Appends an accepted event.
     *
     * @return true if the window was truncated and the caller must rebuild
     *         its dedup set from {@link #keys()}
     */
    public boolean append(MetricEvent event, String key) {
        entries.addLast(new Entry(event, key));
        if (entries.size() <= capacity + slack) {
            return false;
        }
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        return true;
    }

    public List<MetricEvent> events() {
        List<MetricEvent> events = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            events.add(entry.event());
        }
        return events;
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            keys.add(entry.key());
        }
        return keys;
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }

    private record Entry(MetricEvent event, String key) {}
}
