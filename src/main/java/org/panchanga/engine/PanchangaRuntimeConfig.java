package org.panchanga.engine;

import lombok.Builder;
import lombok.Value;
import org.panchanga.traits.zodiac.ZodiacPolicyRegistry;

/**
 * Runtime configuration bound once when the engine is constructed.
 */
@Value
@Builder
public class PanchangaRuntimeConfig {

    /**
     * Selected zodiac policy id (for example {@code SIDEREAL_LAHIRI} or {@code TROPICAL}).
     *
     * <p>Drives Nakshatra, Yoga and the solar sign used for Masa. Tithi and Karana are phase based
     * and do not depend on it.</p>
     */
    String zodiacPolicyId;

    /**
     * Returns the default config (sidereal Lahiri).
     */
    public static PanchangaRuntimeConfig defaults() {
        return PanchangaRuntimeConfig.builder()
                .zodiacPolicyId(PanchangaCore.DEFAULT_ZODIAC_POLICY_ID)
                .build();
    }

    /**
     * Returns convenience config for tropical longitudes.
     */
    public static PanchangaRuntimeConfig tropical() {
        return PanchangaRuntimeConfig.builder()
                .zodiacPolicyId(ZodiacPolicyRegistry.POLICY_TROPICAL)
                .build();
    }
}
