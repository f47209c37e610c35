package com.tradecopier.exception;

import com.tradecopier.domain.enums.AccountRole;

public class InstrumentNotMappedException extends BaseException {

    public InstrumentNotMappedException(long instrumentId, AccountRole source, AccountRole target) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("No %s instrument mapped for %s instrument %d", target, source, instrumentId));
    }
}
