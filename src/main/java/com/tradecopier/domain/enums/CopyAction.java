package com.tradecopier.domain.enums;

/**
 * What the copier does on the slave account in response to one master execution event.
 */
public enum CopyAction {

    /** Open a new slave position mirroring a new master position. */
    OPEN,

    /** Close the paired slave position in full. */
    CLOSE,

    /** Partially close the paired slave position, proportionally to the master's reduction. */
    ADJUST,

    /** Nothing to send. The decision's reason says why. */
    SKIP
}
