package com.tradecopier.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A second OPEN for a master position that is already paired in the ledger. Indicates a
 * classification bug or a replayed fill; the decision is skipped.
 */
@Getter
public class DuplicatePositionException extends BaseException {

    private final long masterPositionId;

    public DuplicatePositionException(long masterPositionId) {
        super(
                ErrorCode.DUPLICATE_POSITION,
                String.format("Position already in ledger: masterPositionId=%d", masterPositionId),
                Map.of("masterPositionId", masterPositionId));
        this.masterPositionId = masterPositionId;
    }
}
