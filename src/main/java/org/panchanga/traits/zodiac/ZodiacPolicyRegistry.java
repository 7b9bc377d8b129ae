package org.panchanga.traits.zodiac;

import org.panchanga.astronomy.CelestialModel;
import org.panchanga.core.math.Angles;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of zodiac reference frames.
 *
 * <p>Sidereal Lahiri and tropical are always present; a custom policy registered under one of
 * their ids replaces it.</p>
 */
public final class ZodiacPolicyRegistry {
    public static final String POLICY_SIDEREAL_LAHIRI = "SIDEREAL_LAHIRI";
    public static final String POLICY_TROPICAL = "TROPICAL";

    private final Map<String, ZodiacPolicy> policiesById;

    public ZodiacPolicyRegistry() {
        this(List.of());
    }

    /**
     * @param customPolicies extra or overriding policies; {@code null} means none.
     * @throws IllegalArgumentException when a custom policy id is blank.
     */
    public ZodiacPolicyRegistry(Collection<? extends ZodiacPolicy> customPolicies) {
        Map<String, ZodiacPolicy> byId = new LinkedHashMap<>();
        for (BuiltInFrame frame : BuiltInFrame.values()) {
            byId.put(frame.id(), frame);
        }
        if (customPolicies != null) {
            for (ZodiacPolicy policy : customPolicies) {
                byId.put(registeredId(policy), policy);
            }
        }
        this.policiesById = Collections.unmodifiableMap(byId);
    }

    /**
     * Returns policy by id, or {@code null} when not registered.
     */
    public ZodiacPolicy policy(String policyId) {
        return policyId == null ? null : policiesById.get(policyId);
    }

    /**
     * Registered ids, built-ins first.
     */
    public Set<String> policyIds() {
        return policiesById.keySet();
    }

    public static ZodiacPolicyRegistry defaultRegistry() {
        return new ZodiacPolicyRegistry();
    }

    private static String registeredId(ZodiacPolicy policy) {
        String id = Objects.requireNonNull(Objects.requireNonNull(policy, "policy").id(), "policy.id").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("policy.id must be non-blank");
        }
        return id;
    }

    private enum BuiltInFrame implements ZodiacPolicy {
        SIDEREAL_LAHIRI {
            @Override
            public double toZodiacLongitude(double tropicalLongitude, double julianInstant, CelestialModel celestialModel) {
                return Angles.normalize(tropicalLongitude - celestialModel.ayanamsa(julianInstant));
            }
        },
        TROPICAL {
            @Override
            public double toZodiacLongitude(double tropicalLongitude, double julianInstant, CelestialModel celestialModel) {
                return Angles.normalize(tropicalLongitude);
            }
        };

        @Override
        public String id() {
            return name();
        }
    }
}
