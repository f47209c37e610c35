package com.tradecopier.domain.model;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * The classifier's verdict for one execution event.
 *
 * <p>{@code requestedSlaveVolume} is the target slave volume after the action: null for OPEN until
 * the Volume Calculator fills it in, the proportional remainder for ADJUST, zero for CLOSE.
 */
@Value
@Builder(toBuilder = true)
public class CopyDecision {

    CopyAction action;
    long instrumentId;
    long masterPositionId;
    PositionSide side;
    BigDecimal masterVolume;
    BigDecimal requestedSlaveVolume;
    DecisionReason reason;

    public static CopyDecision skip(ExecutionEvent event, DecisionReason reason) {
        return CopyDecision.builder()
                .action(CopyAction.SKIP)
                .instrumentId(event.getInstrumentId())
                .masterPositionId(event.getMasterPositionId())
                .side(event.getSide())
                .masterVolume(event.getResultingMasterVolume())
                .reason(reason)
                .build();
    }

    public boolean isSkip() {
        return action == CopyAction.SKIP;
    }
}
