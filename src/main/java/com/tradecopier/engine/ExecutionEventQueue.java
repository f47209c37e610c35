package com.tradecopier.engine;

import com.tradecopier.domain.model.ExecutionEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * FIFO hand-off of master execution events from the transport to the copy lanes.
 *
 * <p>Unbounded: the transport callback must never block, and master activity is bounded by what
 * a human or strategy trades.
 */
@Component
public class ExecutionEventQueue {

    private final BlockingQueue<ExecutionEvent> queue = new LinkedBlockingQueue<>();

    public void offer(ExecutionEvent event) {
        queue.add(event);
    }

    public ExecutionEvent take() throws InterruptedException {
        return queue.take();
    }

    public ExecutionEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Removes and returns everything queued, in arrival order. */
    public List<ExecutionEvent> drain() {
        List<ExecutionEvent> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public int size() {
        return queue.size();
    }
}
