package com.tradecopier.sizing;

import com.tradecopier.domain.enums.VolumePolicyType;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link VolumePolicy} implementation by {@link VolumePolicyType}.
 *
 * <p>Spring discovers all VolumePolicy beans and this factory indexes them by type at
 * construction time. A missing type is a wiring error and fails fast.
 */
@Component
public class VolumePolicyFactory {

    private final Map<VolumePolicyType, VolumePolicy> policiesByType;

    public VolumePolicyFactory(List<VolumePolicy> volumePolicies) {
        this.policiesByType =
                volumePolicies.stream().collect(Collectors.toMap(VolumePolicy::getType, Function.identity()));
    }

    /**
     * @throws IllegalArgumentException if no policy is registered for the type
     */
    public VolumePolicy getPolicy(VolumePolicyType volumePolicyType) {
        VolumePolicy volumePolicy = policiesByType.get(volumePolicyType);
        if (volumePolicy == null) {
            throw new IllegalArgumentException("No volume policy found for type: " + volumePolicyType);
        }
        return volumePolicy;
    }

    /**
     * The explicitly configured policy, or else the first configured one in precedence order.
     * PER_INSTRUMENT always has its default multiplier, so it is the last resort.
     */
    public VolumePolicyType resolveActive(VolumePolicyType explicitPolicy) {
        if (explicitPolicy != null) {
            return explicitPolicy;
        }
        for (VolumePolicyType type : VolumePolicyType.values()) {
            VolumePolicy volumePolicy = policiesByType.get(type);
            if (volumePolicy != null && volumePolicy.isConfigured()) {
                return type;
            }
        }
        return VolumePolicyType.PER_INSTRUMENT;
    }
}
