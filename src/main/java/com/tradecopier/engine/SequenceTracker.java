package com.tradecopier.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-instrument high-water mark of processed execution event sequence numbers.
 *
 * <p>Marks are only meaningful within one connection epoch: the Session Coordinator calls
 * {@link #reset()} every time a session reaches SUBSCRIBED, which clears all marks.
 *
 * <p>Each instrument is owned by exactly one copy lane, so reads and writes for one key never
 * race; the map itself is concurrent because different lanes touch different keys.
 */
@Component
public class SequenceTracker {

    private static final Logger log = LoggerFactory.getLogger(SequenceTracker.class);

    private final Map<Long, Long> highWaterMarks = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();

    /** Whether {@code sequenceNo} is at or below the instrument's mark. */
    public boolean isDuplicate(long instrumentId, long sequenceNo) {
        Long mark = highWaterMarks.get(instrumentId);
        return mark != null && sequenceNo <= mark;
    }

    /** Raises the instrument's mark to {@code sequenceNo}. Never lowers it. */
    public void advance(long instrumentId, long sequenceNo) {
        highWaterMarks.merge(instrumentId, sequenceNo, Math::max);
    }

    public long highWaterMark(long instrumentId) {
        return highWaterMarks.getOrDefault(instrumentId, Long.MIN_VALUE);
    }

    /** Starts a new connection epoch. */
    public long reset() {
        highWaterMarks.clear();
        long newEpoch = epoch.incrementAndGet();
        log.info("Sequence tracker reset, epoch={}", newEpoch);
        return newEpoch;
    }

    public long currentEpoch() {
        return epoch.get();
    }
}
