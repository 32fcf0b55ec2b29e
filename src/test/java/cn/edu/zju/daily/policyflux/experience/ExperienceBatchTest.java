package cn.edu.zju.daily.policyflux.experience;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ExperienceBatchTest {

    @Test
    void testExtendPreservesOrder() {
        ExperienceBatch first = Batches.of(2, 1.0);
        ExperienceBatch second = Batches.of(3, 2.0);

        first.extend(second);

        assertEquals(5, first.size());
        assertEquals(1.0, first.getTransitions().get(1).getReward());
        assertEquals(2.0, first.getTransitions().get(2).getReward());
        assertEquals(3, second.size());
    }

    @Test
    void testEmpty() {
        assertTrue(new ExperienceBatch().isEmpty());
        assertFalse(Batches.of(1, 0).isEmpty());
    }
}
