package com.tradecopier.engine;

import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.ExecutionEvent;

/**
 * One unit of work queued on a copy lane: either a raw execution event or a decision issued
 * directly (reconciliation OPENs). Kept as a named type so that tasks dropped at shutdown can be
 * logged with what they carried.
 */
final class LaneTask implements Runnable {

    private final ExecutionEvent event;
    private final CopyDecision decision;
    private final Runnable work;

    private LaneTask(ExecutionEvent event, CopyDecision decision, Runnable work) {
        this.event = event;
        this.decision = decision;
        this.work = work;
    }

    static LaneTask forEvent(ExecutionEvent event, Runnable work) {
        return new LaneTask(event, null, work);
    }

    static LaneTask forDecision(CopyDecision decision, Runnable work) {
        return new LaneTask(null, decision, work);
    }

    long instrumentId() {
        return event != null ? event.getInstrumentId() : decision.getInstrumentId();
    }

    long masterPositionId() {
        return event != null ? event.getMasterPositionId() : decision.getMasterPositionId();
    }

    String describe() {
        if (event != null) {
            return String.format(
                    "%s seq=%d masterPositionId=%d instrumentId=%d",
                    event.getKind(), event.getSequenceNo(), event.getMasterPositionId(), event.getInstrumentId());
        }
        return String.format(
                "%s masterPositionId=%d instrumentId=%d",
                decision.getAction(), decision.getMasterPositionId(), decision.getInstrumentId());
    }

    @Override
    public void run() {
        work.run();
    }
}
