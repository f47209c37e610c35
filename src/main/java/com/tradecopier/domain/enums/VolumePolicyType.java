package com.tradecopier.domain.enums;

/**
 * Closed set of slave volume sizing policies, in precedence order.
 *
 * <p>When {@code copier.volume.policy} is not set, the first policy whose parameters are
 * configured wins, in declaration order. Each type maps to one
 * {@link com.tradecopier.sizing.VolumePolicy} resolved by
 * {@link com.tradecopier.sizing.VolumePolicyFactory}.
 */
public enum VolumePolicyType {

    /** Master volume times one global multiplier. */
    GLOBAL_MULTIPLIER,

    /** Master volume times a per-instrument multiplier, with a default for unlisted instruments. */
    PER_INSTRUMENT,

    /** Fixed share of the slave balance converted to lots, independent of master volume. */
    BALANCE_PERCENTAGE,

    /** Equalizes the money value of one pip between master and slave instruments. */
    DYNAMIC_PIP
}
