package com.linlay.taskrunner.agent.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * FIFO crossing point between tool threads and the thread driving a run. Any thread may
 * {@link #deliver}; only the owning run consumes.
 */
public final class RunChannel<T> {

    private final String name;
    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();

    public RunChannel(String name) {
        this.name = name == null ? "channel" : name;
    }

    public boolean deliver(T item) {
        if (item == null) {
            return false;
        }
        return queue.offer(item);
    }

    public List<T> drain() {
        List<T> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    @Override
    public String toString() {
        return "RunChannel[" + name + "]";
    }
}
