package com.tradecopier.engine;

import com.tradecopier.domain.enums.CopyAction;
import com.tradecopier.domain.enums.DecisionReason;
import com.tradecopier.domain.model.CopyDecision;
import com.tradecopier.domain.model.ExecutionEvent;
import com.tradecopier.domain.model.Position;
import com.tradecopier.ledger.PositionLedger;
import com.tradecopier.sizing.VolumeCalculator;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns one master execution event into a {@link CopyDecision}.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>deal id at or below the instrument's high-water mark: SKIP/DUPLICATE</li>
 *   <li>not a fill, partial fill or position close: SKIP/NOT_POSITION_IMPACTING</li>
 *   <li>position unknown to the ledger: OPEN for a fill that takes the position from zero (its
 *       deal volume equals the resulting volume), otherwise CLOSE or ADJUST that will fail with
 *       NotFound at dispatch</li>
 *   <li>position known: CLOSE at zero volume, proportional ADJUST on a reduction, SKIP when the
 *       volume is unchanged or increased</li>
 * </ol>
 *
 * <p>Classification reads the ledger and the sequence tracker but changes neither. The caller
 * advances the tracker after classifying.
 */
@Component
public class ExecutionEventClassifier {

    private final SequenceTracker sequenceTracker;
    private final VolumeCalculator volumeCalculator;

    public ExecutionEventClassifier(SequenceTracker sequenceTracker, VolumeCalculator volumeCalculator) {
        this.sequenceTracker = sequenceTracker;
        this.volumeCalculator = volumeCalculator;
    }

    public CopyDecision classify(ExecutionEvent event, PositionLedger positionLedger) {
        if (event.isDealSequenced() && sequenceTracker.isDuplicate(event.getInstrumentId(), event.getSequenceNo())) {
            return CopyDecision.skip(event, DecisionReason.DUPLICATE);
        }
        if (!event.getKind().isPositionImpacting()) {
            return CopyDecision.skip(event, DecisionReason.NOT_POSITION_IMPACTING);
        }

        BigDecimal resulting = event.getResultingMasterVolume();
        Optional<Position> recorded = positionLedger.find(event.getMasterPositionId());

        if (recorded.isEmpty()) {
            return classifyUnseen(event, resulting);
        }

        Position position = recorded.get();
        int comparison = resulting.compareTo(position.getMasterVolume());
        if (resulting.signum() == 0) {
            return decision(event, CopyAction.CLOSE, BigDecimal.ZERO, DecisionReason.FULL_CLOSE);
        }
        if (comparison < 0) {
            BigDecimal newSlaveVolume = VolumeCalculator.scaleToStep(
                    resulting,
                    position.getMasterVolume(),
                    position.getSlaveVolume(),
                    volumeCalculator.lotStep(event.getInstrumentId()));
            return decision(event, CopyAction.ADJUST, newSlaveVolume, DecisionReason.PARTIAL_CLOSE);
        }
        if (comparison == 0) {
            return CopyDecision.skip(event, DecisionReason.NO_VOLUME_CHANGE);
        }
        return CopyDecision.skip(event, DecisionReason.VOLUME_INCREASE);
    }

    private CopyDecision classifyUnseen(ExecutionEvent event, BigDecimal resulting) {
        // A partial close also carries a positive deal volume; only a fill from zero opens.
        boolean openingFill = event.getKind().isFill()
                && event.getVolumeDelta() != null
                && event.getVolumeDelta().signum() > 0
                && resulting.compareTo(event.getVolumeDelta()) == 0;
        if (openingFill) {
            return decision(event, CopyAction.OPEN, null, DecisionReason.NEW_POSITION);
        }
        if (resulting.signum() == 0) {
            return decision(event, CopyAction.CLOSE, BigDecimal.ZERO, DecisionReason.UNKNOWN_POSITION);
        }
        return decision(event, CopyAction.ADJUST, null, DecisionReason.UNKNOWN_POSITION);
    }

    private static CopyDecision decision(
            ExecutionEvent event, CopyAction action, BigDecimal requestedSlaveVolume, DecisionReason reason) {
        return CopyDecision.builder()
                .action(action)
                .instrumentId(event.getInstrumentId())
                .masterPositionId(event.getMasterPositionId())
                .side(event.getSide())
                .masterVolume(event.getResultingMasterVolume())
                .requestedSlaveVolume(requestedSlaveVolume)
                .reason(reason)
                .build();
    }
}
