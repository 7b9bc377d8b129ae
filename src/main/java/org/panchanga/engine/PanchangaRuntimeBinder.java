package org.panchanga.engine;

import lombok.Builder;
import lombok.Value;
import org.panchanga.traits.zodiac.ZodiacPolicy;
import org.panchanga.traits.zodiac.ZodiacPolicyRegistry;

import java.util.Objects;

/**
 * Startup-only runtime binder.
 *
 * <p>Validates one runtime config and resolves the zodiac policy once; every query afterwards uses
 * the immutable binding.</p>
 */
public final class PanchangaRuntimeBinder {

    /**
     * Binds one runtime config.
     *
     * @param runtimeConfig engine runtime configuration.
     * @param zodiacPolicyRegistry registry the policy id is resolved against.
     * @return immutable binding.
     * @throws PanchangaException when the config is missing or names an unknown policy.
     */
    public Binding bind(PanchangaRuntimeConfig runtimeConfig, ZodiacPolicyRegistry zodiacPolicyRegistry) {
        if (runtimeConfig == null) {
            throw new PanchangaException(
                    PanchangaCore.REASON_CONFIG_REQUIRED,
                    "runtimeConfig must be provided at startup"
            );
        }
        ZodiacPolicyRegistry nonNullRegistry = Objects.requireNonNull(zodiacPolicyRegistry, "zodiacPolicyRegistry");

        String policyId = normalizeRequiredId(runtimeConfig.getZodiacPolicyId());
        ZodiacPolicy policy = nonNullRegistry.policy(policyId);
        if (policy == null) {
            throw new PanchangaException(
                    PanchangaCore.REASON_UNKNOWN_ZODIAC_POLICY,
                    "unknown zodiac policy id: " + policyId + " (registered: " + nonNullRegistry.policyIds() + ")"
            );
        }
        return Binding.builder()
                .zodiacPolicyId(policy.id())
                .zodiacPolicy(policy)
                .build();
    }

    private static String normalizeRequiredId(String id) {
        String normalized = id == null ? "" : id.trim();
        if (normalized.isEmpty()) {
            throw new PanchangaException(PanchangaCore.REASON_CONFIG_REQUIRED, "zodiacPolicyId must be provided");
        }
        return normalized;
    }

    /**
     * Immutable runtime binding output.
     */
    @Value
    @Builder
    public static class Binding {
        /** Id of the bound policy. */
        String zodiacPolicyId;
        /** Policy used for every sidereal-dependent element. */
        ZodiacPolicy zodiacPolicy;
    }
}
