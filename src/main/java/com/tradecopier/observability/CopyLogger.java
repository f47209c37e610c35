package com.tradecopier.observability;

import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.ExecutionEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes the copier's structured log lines.
 *
 * <p>Every line starts with a tag ({@code [OPEN]}, {@code [ADJUST]}, {@code [CLOSE]},
 * {@code [VOLUME]}, {@code [RECONCILE]}, {@code [ERROR]}) followed by the master position id,
 * the instrument id and the computed values, so a grep on the tag reconstructs the copy history
 * of a session. Lines go through SLF4J to the Logback appenders.
 *
 * <p>The last {@value #RING_BUFFER_SIZE} records are also kept in memory, newest first, for
 * {@code GET /api/copier/log}.
 */
@Service
public class CopyLogger {

    private static final Logger logger = LoggerFactory.getLogger(CopyLogger.class);

    static final int RING_BUFFER_SIZE = 500;

    private final ConcurrentLinkedDeque<CopyLogRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    // ---- Actions ----

    public void logOpen(CopyDecision decision, Long slavePositionId, BigDecimal slaveVolume) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("side", decision.getSide());
        values.put("masterVolume", decision.getMasterVolume());
        values.put("slaveVolume", slaveVolume);
        values.put("slavePositionId", slavePositionId);
        info(CopyLogTag.OPEN, decision.getMasterPositionId(), decision.getInstrumentId(), "Copied open", values);
    }

    public void logAdjust(
            CopyDecision decision, BigDecimal masterBefore, BigDecimal slaveBefore, BigDecimal closedVolume) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("masterBefore", masterBefore);
        values.put("masterAfter", decision.getMasterVolume());
        values.put("slaveBefore", slaveBefore);
        values.put("slaveAfter", decision.getRequestedSlaveVolume());
        values.put("closedVolume", closedVolume);
        info(CopyLogTag.ADJUST, decision.getMasterPositionId(), decision.getInstrumentId(), "Copied partial close", values);
    }

    public void logClose(CopyDecision decision, Long slavePositionId, BigDecimal slaveVolume) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("slavePositionId", slavePositionId);
        values.put("slaveVolume", slaveVolume);
        info(CopyLogTag.CLOSE, decision.getMasterPositionId(), decision.getInstrumentId(), "Copied close", values);
    }

    // ---- Volume sizing ----

    public void logVolume(long instrumentId, String message, Map<String, Object> values) {
        append(CopyLogTag.VOLUME, null, instrumentId, message, values);
        logger.info("{} instrumentId={} {} {}", CopyLogTag.VOLUME.bracketed(), instrumentId, message, values);
    }

    public void logVolumeWarning(long instrumentId, String message, Map<String, Object> values) {
        append(CopyLogTag.VOLUME, null, instrumentId, message, values);
        logger.warn("{} instrumentId={} {} {}", CopyLogTag.VOLUME.bracketed(), instrumentId, message, values);
    }

    // ---- Reconciliation ----

    public void logReconcile(String message, Map<String, Object> values) {
        append(CopyLogTag.RECONCILE, null, null, message, values);
        logger.info("{} {} {}", CopyLogTag.RECONCILE.bracketed(), message, values);
    }

    // ---- Errors ----

    public void logError(CopyDecision decision, String message) {
        error(decision.getMasterPositionId(), decision.getInstrumentId(), message);
    }

    public void logError(ExecutionEvent event, String message) {
        error(event.getMasterPositionId(), event.getInstrumentId(), message);
    }

    public void logError(String message) {
        append(CopyLogTag.ERROR, null, null, message, Map.of());
        logger.error("{} {}", CopyLogTag.ERROR.bracketed(), message);
    }

    /** Newest first, at most {@code limit} records. */
    public List<CopyLogRecord> recent(int limit) {
        List<CopyLogRecord> records = new ArrayList<>();
        for (CopyLogRecord copyLogRecord : ringBuffer) {
            if (records.size() >= limit) {
                break;
            }
            records.add(copyLogRecord);
        }
        return records;
    }

    private void info(CopyLogTag tag, long masterPositionId, long instrumentId, String message, Map<String, Object> values) {
        append(tag, masterPositionId, instrumentId, message, values);
        logger.info(
                "{} masterPositionId={} instrumentId={} {} {}",
                tag.bracketed(),
                masterPositionId,
                instrumentId,
                message,
                values);
    }

    private void error(long masterPositionId, long instrumentId, String message) {
        append(CopyLogTag.ERROR, masterPositionId, instrumentId, message, Map.of());
        logger.error(
                "{} masterPositionId={} instrumentId={} {}",
                CopyLogTag.ERROR.bracketed(),
                masterPositionId,
                instrumentId,
                message);
    }

    private void append(CopyLogTag tag, Long masterPositionId, Long instrumentId, String message, Map<String, Object> values) {
        ringBuffer.addFirst(CopyLogRecord.builder()
                .timestamp(Instant.now())
                .tag(tag)
                .masterPositionId(masterPositionId)
                .instrumentId(instrumentId)
                .message(message)
                .values(values)
                .build());
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }
    }
}
