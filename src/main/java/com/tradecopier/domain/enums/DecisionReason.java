package com.tradecopier.domain.enums;

/**
 * Why the classifier produced a given decision. Only SKIP decisions carry a non-trivial reason;
 * actionable decisions use {@link #NEW_POSITION}, {@link #FULL_CLOSE} or {@link #PARTIAL_CLOSE}.
 */
public enum DecisionReason {
    NEW_POSITION,
    FULL_CLOSE,
    PARTIAL_CLOSE,
    /** Close or reduction for a position the ledger has never seen. Yields NotFound at dispatch. */
    UNKNOWN_POSITION,
    /** Issued by reconciliation for a master position left without a slave counterpart. */
    RECONCILIATION,
    DUPLICATE,
    NOT_POSITION_IMPACTING,
    NO_VOLUME_CHANGE,
    VOLUME_INCREASE
}
