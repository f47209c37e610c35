package com.tradecopier.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class PositionNotFoundException extends BaseException {

    private final long masterPositionId;

    public PositionNotFoundException(long masterPositionId) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("Position not found in ledger: masterPositionId=%d", masterPositionId),
                Map.of("masterPositionId", masterPositionId));
        this.masterPositionId = masterPositionId;
    }
}
