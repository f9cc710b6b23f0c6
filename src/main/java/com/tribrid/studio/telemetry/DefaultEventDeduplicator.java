package com.tribrid.studio.telemetry;

import com.tribrid.studio.config.StudioConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Default implementation of EventDeduplicator backed by a hash set.
 *
 * Confined to the studio loop thread, so no synchronization.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultEventDeduplicator implements EventDeduplicator {

    private final StudioConfig studioConfig;

    private final Set<String> seenKeys = new HashSet<>();

    @Override
    public boolean isNew(String key) {
        if (!studioConfig.getFeatures().isDeduplicationEnabled()) {
            return true;
        }
        return !seenKeys.contains(key);
    }

    @Override
    public void mark(String key) {
        if (studioConfig.getFeatures().isDeduplicationEnabled()) {
            seenKeys.add(key);
        }
    }

    @Override
    public void clear() {
        int cleared = seenKeys.size();
        seenKeys.clear();
        log.debug("Cleared {} deduplication keys", cleared);
    }

    @Override
    public int size() {
        return seenKeys.size();
    }
}
