package cn.edu.zju.daily.policyflux.manager;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.policyflux.experience.Batches;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PolicyRegistryTest {

    private static Map<String, String> assignment() {
        Map<String, String> assignment = new LinkedHashMap<>();
        assignment.put("a", "t0");
        assignment.put("b", "t1");
        assignment.put("c", "t0");
        return assignment;
    }

    @Test
    void testThresholdDefaults() {
        PolicyRegistry registry =
                new PolicyRegistry(assignment(), Map.of("a", 10, "b", 0), Map.of("c", 7));
        assertEquals(10, registry.get("a").getTrigger());
        assertEquals(1, registry.get("b").getTrigger());
        assertEquals(1, registry.get("c").getTrigger());
        assertEquals(1, registry.get("a").getWarmup());
        assertEquals(7, registry.get("c").getWarmup());
    }

    @Test
    void testTrainerLookups() {
        PolicyRegistry registry = new PolicyRegistry(assignment(), null, null);
        assertEquals(List.of("t0", "t1"), registry.trainerIds());
        assertEquals(List.of("a", "c"), registry.policiesOf("t0"));
        assertTrue(registry.policiesOf("t9").isEmpty());
        assertEquals("t1", registry.trainerOf("b"));
        assertEquals(List.of("a", "b", "c"), registry.policyNames());
    }

    @Test
    void testUnknownPolicies() {
        PolicyRegistry registry = new PolicyRegistry(assignment(), null, null);
        assertFalse(registry.contains("z"));
        assertThrows(IllegalArgumentException.class, () -> registry.get("z"));
        assertThrows(
                PolicyConfigurationException.class,
                () -> new PolicyRegistry(assignment(), Map.of("z", 3), null));
        assertThrows(
                PolicyConfigurationException.class,
                () -> new PolicyRegistry(assignment(), null, Map.of("z", 3)));
    }

    @Test
    void testPendingExperienceIsMovedOut() {
        PolicyRegistry registry = new PolicyRegistry(assignment(), Map.of("a", 4), Map.of("a", 6));
        PolicyEntry entry = registry.get("a");

        entry.accumulate(Batches.of(3, 1.0));
        assertFalse(entry.isDue(entry.getTotalExperience()));
        entry.accumulate(Batches.of(2, 1.0));
        assertFalse(entry.isDue(entry.getTotalExperience()));
        entry.accumulate(Batches.of(1, 1.0));
        assertTrue(entry.isDue(entry.getTotalExperience()));

        assertEquals(6, entry.takePending().size());
        assertTrue(entry.getPending().isEmpty());
        assertEquals(0, entry.getNewExperience());
        assertEquals(6, entry.getTotalExperience());
    }
}
