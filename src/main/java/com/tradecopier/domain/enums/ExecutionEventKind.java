package com.tradecopier.domain.enums;

import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Normalized execution notification kinds received from the master account.
 *
 * <p>Each constant carries the venue's numeric execution type. Only fills, partial fills and
 * position closes change a position's volume; everything else is skipped by the classifier.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionEventKind {
    ORDER_ACCEPTED(2),
    ORDER_FILLED(3),
    ORDER_REPLACED(4),
    ORDER_CANCELLED(5),
    ORDER_EXPIRED(6),
    ORDER_REJECTED(7),
    /** Cancel request rejected. Treated like a rejection for copy purposes. */
    ORDER_CANCEL_REJECTED(8),
    SWAP(9),
    DEPOSIT_WITHDRAW(10),
    ORDER_PARTIALLY_FILLED(11),
    /** Synthesized by the transport when a fill leaves the master position closed. */
    POSITION_CLOSED(-1),
    UNKNOWN(0);

    private static final Set<ExecutionEventKind> POSITION_IMPACTING =
            Set.of(ORDER_FILLED, ORDER_PARTIALLY_FILLED, POSITION_CLOSED);

    private final int venueCode;

    public boolean isPositionImpacting() {
        return POSITION_IMPACTING.contains(this);
    }

    public boolean isFill() {
        return this == ORDER_FILLED || this == ORDER_PARTIALLY_FILLED;
    }

    public static ExecutionEventKind fromVenueCode(int venueCode) {
        for (ExecutionEventKind kind : values()) {
            if (kind.venueCode == venueCode && kind != UNKNOWN) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
