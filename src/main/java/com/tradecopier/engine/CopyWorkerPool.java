package com.tradecopier.engine;

import com.tradecopier.config.CopierProperties;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.observability.CopyLogger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link CopyPipeline} on a fixed set of single-threaded lanes.
 *
 * <p>A router thread takes events from the {@link ExecutionEventQueue} in arrival order and hands
 * each to lane {@code instrumentId mod lanes}. A lane's FIFO task queue is the hand-off between
 * router and worker, so all events of one instrument run one at a time and in order, while
 * different instruments run in parallel on different lanes.
 *
 * <p>Shutdown (phase {@value #PHASE}, above the Session Coordinator's, so the pool stops first):
 * unstarted tasks of every lane and whatever is still in the inbound queue are drained and logged
 * as dropped, in-flight dispatches get {@code copier.shutdown.grace-period} to finish, then the
 * lanes are interrupted.
 */
@Component
public class CopyWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CopyWorkerPool.class);

    static final int PHASE = 200;

    private final ExecutionEventQueue executionEventQueue;
    private final CopyPipeline copyPipeline;
    private final CopyLogger copyLogger;
    private final int laneCount;
    private final Duration gracePeriod;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile List<ThreadPoolExecutor> lanes = List.of();
    private Thread routerThread;

    public CopyWorkerPool(
            ExecutionEventQueue executionEventQueue,
            CopyPipeline copyPipeline,
            CopyLogger copyLogger,
            CopierProperties copierProperties) {
        this.executionEventQueue = executionEventQueue;
        this.copyPipeline = copyPipeline;
        this.copyLogger = copyLogger;
        this.laneCount = copierProperties.getWorkers().getLanes();
        this.gracePeriod = copierProperties.getShutdown().getGracePeriod();
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            List<ThreadPoolExecutor> newLanes = new ArrayList<>();
            for (int i = 0; i < laneCount; i++) {
                newLanes.add(newLane(i));
            }
            lanes = List.copyOf(newLanes);
            routerThread = new Thread(this::routeLoop, "copy-router");
            routerThread.setDaemon(true);
            routerThread.start();
            log.info("CopyWorkerPool started with {} lanes", laneCount);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("CopyWorkerPool stopping");
        if (routerThread != null) {
            routerThread.interrupt();
            try {
                routerThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (ExecutionEvent event : executionEventQueue.drain()) {
            copyLogger.logError(event, "dropped on shutdown: " + event.getKind() + " seq=" + event.getSequenceNo());
        }

        int dropped = 0;
        for (ThreadPoolExecutor lane : lanes) {
            List<Runnable> unstarted = new ArrayList<>();
            lane.getQueue().drainTo(unstarted);
            for (Runnable runnable : unstarted) {
                logDropped(runnable);
                dropped++;
            }
            lane.shutdown();
        }

        long deadline = System.nanoTime() + gracePeriod.toNanos();
        for (ThreadPoolExecutor lane : lanes) {
            long remaining = deadline - System.nanoTime();
            try {
                if (remaining <= 0 || !lane.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    List<Runnable> interrupted = lane.shutdownNow();
                    interrupted.forEach(this::logDropped);
                    log.warn("Copy lane did not finish within {}, interrupted", gracePeriod);
                }
            } catch (InterruptedException e) {
                lane.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("CopyWorkerPool stopped, {} queued tasks dropped", dropped);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /** Queues a decision that did not come from an execution event on its instrument's lane. */
    public void submitDecision(CopyDecision decision) {
        submit(LaneTask.forDecision(decision, () -> runDecision(decision)));
    }

    public int laneFor(long instrumentId) {
        return (int) Math.floorMod(instrumentId, (long) laneCount);
    }

    /** Unstarted tasks per lane, in lane order. Empty before {@link #start()}. */
    public List<Integer> laneQueueDepths() {
        return lanes.stream().map(lane -> lane.getQueue().size()).toList();
    }

    private void routeLoop() {
        while (running.get()) {
            try {
                ExecutionEvent event = executionEventQueue.take();
                submit(LaneTask.forEvent(event, () -> runEvent(event)));
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Copy router interrupted unexpectedly, resuming");
            }
        }
    }

    private void submit(LaneTask laneTask) {
        List<ThreadPoolExecutor> current = lanes;
        if (current.isEmpty()) {
            logDropped(laneTask);
            return;
        }
        try {
            current.get(laneFor(laneTask.instrumentId())).execute(laneTask);
        } catch (RejectedExecutionException e) {
            logDropped(laneTask);
        }
    }

    private void runEvent(ExecutionEvent event) {
        try {
            copyPipeline.process(event);
        } catch (RuntimeException e) {
            log.error("Copy of masterPositionId={} failed", event.getMasterPositionId(), e);
            copyLogger.logError(event, "Unhandled failure: " + e);
        }
    }

    private void runDecision(CopyDecision decision) {
        try {
            copyPipeline.execute(decision);
        } catch (RuntimeException e) {
            log.error("Copy of masterPositionId={} failed", decision.getMasterPositionId(), e);
            copyLogger.logError(decision, "Unhandled failure: " + e);
        }
    }

    private void logDropped(Runnable runnable) {
        if (runnable instanceof LaneTask laneTask) {
            copyLogger.logError("dropped on shutdown: " + laneTask.describe());
        } else {
            copyLogger.logError("dropped on shutdown: " + runnable);
        }
    }

    private static ThreadPoolExecutor newLane(int index) {
        AtomicInteger threadCount = new AtomicInteger();
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), runnable -> {
            Thread thread = new Thread(runnable, "copy-lane-" + index + "-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
