package com.linlay.taskrunner.cache;

import com.linlay.taskrunner.model.AgentEvent;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store of complete event sequences of earlier runs.
 */
public interface RunEventCache {

    Optional<List<AgentEvent>> get(String key);

    void put(String key, List<AgentEvent> events);

    void invalidate(String key);

    void clear();
}
