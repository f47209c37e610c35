package com.tradecopier.sizing;

import com.tradecopier.domain.enums.VolumePolicyType;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Computes the raw slave volume, in lots, for one master volume.
 *
 * <p>Implementations are pure: the same context always gives the same result. They do not clamp
 * or round; {@link VolumeCalculator} post-processes every result the same way.
 *
 * <p>Four implementations exist, one per {@link VolumePolicyType}, resolved by
 * {@link VolumePolicyFactory}.
 */
public interface VolumePolicy {

    /**
     * @return the raw slave volume, or empty when the inputs this policy needs are missing and
     *     the caller must fall back to the global multiplier
     */
    Optional<BigDecimal> rawVolume(VolumeContext volumeContext);

    /** Whether this policy's parameters are present in the configuration. */
    boolean isConfigured();

    VolumePolicyType getType();
}
