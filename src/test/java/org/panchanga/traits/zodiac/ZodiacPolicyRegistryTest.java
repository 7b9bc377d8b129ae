package org.panchanga.traits.zodiac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.panchanga.astronomy.CelestialModel;
import org.panchanga.testutil.FixedAngleCelestialModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ZodiacPolicyRegistry Tests")
class ZodiacPolicyRegistryTest {
    private static final CelestialModel AYANAMSA_24 = new FixedAngleCelestialModel(0.0d, 0.0d, 24.0d);

    @Test
    @DisplayName("Default registry exposes sidereal Lahiri and tropical policies")
    void testDefaultRegistryBuiltIns() {
        ZodiacPolicyRegistry registry = ZodiacPolicyRegistry.defaultRegistry();
        assertNotNull(registry.policy(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI));
        assertNotNull(registry.policy(ZodiacPolicyRegistry.POLICY_TROPICAL));
        assertEquals(2, registry.policyIds().size());
    }

    @Test
    @DisplayName("Null and unknown lookups return null")
    void testUnknownLookupReturnsNull() {
        ZodiacPolicyRegistry registry = ZodiacPolicyRegistry.defaultRegistry();
        assertNull(registry.policy(null));
        assertNull(registry.policy("FAGAN_BRADLEY"));
    }

    @Test
    @DisplayName("Sidereal policy subtracts the ayanamsa and wraps")
    void testSiderealConversion() {
        ZodiacPolicy policy = ZodiacPolicyRegistry.defaultRegistry().policy(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI);
        assertEquals(276.0d, policy.toZodiacLongitude(300.0d, 0.0d, AYANAMSA_24), 1e-9);
        assertEquals(346.0d, policy.toZodiacLongitude(10.0d, 0.0d, AYANAMSA_24), 1e-9);
    }

    @Test
    @DisplayName("Tropical policy only normalizes")
    void testTropicalConversion() {
        ZodiacPolicy policy = ZodiacPolicyRegistry.defaultRegistry().policy(ZodiacPolicyRegistry.POLICY_TROPICAL);
        assertEquals(300.0d, policy.toZodiacLongitude(300.0d, 0.0d, AYANAMSA_24), 1e-9);
        assertEquals(5.0d, policy.toZodiacLongitude(365.0d, 0.0d, AYANAMSA_24), 1e-9);
    }

    @Test
    @DisplayName("Custom policies override built-ins on id collision")
    void testCustomOverride() {
        ZodiacPolicy custom = fixedPolicy(ZodiacPolicyRegistry.POLICY_TROPICAL, 42.0d);
        ZodiacPolicyRegistry registry = new ZodiacPolicyRegistry(List.of(custom));

        assertSame(custom, registry.policy(ZodiacPolicyRegistry.POLICY_TROPICAL));
        assertNotNull(registry.policy(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI));
    }

    @Test
    @DisplayName("Custom policies are added after the built-ins")
    void testCustomPolicyAdded() {
        ZodiacPolicyRegistry registry = new ZodiacPolicyRegistry(List.of(fixedPolicy(" FAGAN_BRADLEY ", 1.0d)));

        assertEquals(List.of(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI, ZodiacPolicyRegistry.POLICY_TROPICAL, "FAGAN_BRADLEY"),
                new ArrayList<>(registry.policyIds()));
        assertEquals(1.0d, registry.policy("FAGAN_BRADLEY").toZodiacLongitude(200.0d, 0.0d, AYANAMSA_24));
    }

    @Test
    @DisplayName("Built-in ids match their constants")
    void testBuiltInIds() {
        ZodiacPolicyRegistry registry = ZodiacPolicyRegistry.defaultRegistry();
        assertEquals(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI,
                registry.policy(ZodiacPolicyRegistry.POLICY_SIDEREAL_LAHIRI).id());
        assertEquals(ZodiacPolicyRegistry.POLICY_TROPICAL, registry.policy(ZodiacPolicyRegistry.POLICY_TROPICAL).id());
    }

    @Test
    @DisplayName("Null custom collection falls back to built-ins")
    void testNullCustomCollection() {
        ZodiacPolicyRegistry registry = new ZodiacPolicyRegistry((Collection<? extends ZodiacPolicy>) null);
        assertEquals(2, registry.policyIds().size());
    }

    @Test
    @DisplayName("Blank policy id is rejected")
    void testBlankIdRejected() {
        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> new ZodiacPolicyRegistry(List.of(fixedPolicy("  ", 0.0d)))
        );
        assertEquals("policy.id must be non-blank", ex.getMessage());
    }

    private static ZodiacPolicy fixedPolicy(String id, double longitude) {
        return new ZodiacPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public double toZodiacLongitude(double tropicalLongitude, double julianInstant, CelestialModel celestialModel) {
                return longitude;
            }
        };
    }
}
