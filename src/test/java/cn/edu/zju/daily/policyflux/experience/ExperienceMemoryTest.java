package cn.edu.zju.daily.policyflux.experience;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ExperienceMemoryTest {

    @Test
    void testOverwritesOldestWhenFull() {
        ExperienceMemory memory = new ExperienceMemory(4);
        memory.put(Batches.of(3, 1.0));
        memory.put(Batches.of(3, 2.0));

        assertEquals(4, memory.size());
        assertEquals(4, memory.getCapacity());
        assertEquals(2, memory.getOverwritten());
        List<Transition> all = memory.getAll();
        assertEquals(1.0, all.get(0).getReward());
        assertEquals(2.0, all.get(3).getReward());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ExperienceMemory(0));
    }

    @Test
    void testClear() {
        ExperienceMemory memory = new ExperienceMemory(10);
        memory.put(Batches.of(5, 1.0));
        memory.clear();
        assertEquals(0, memory.size());
    }
}
