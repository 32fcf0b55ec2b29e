package cn.edu.zju.daily.policyflux.policy;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.policyflux.experience.Batches;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PolicyCheckpointerTest {

    @TempDir Path dir;

    @Test
    void testSaveAndLoad() {
        CountingPolicy policy = new CountingPolicy("dqn");
        policy.getExperienceStore().put(Batches.of(3, 2.0));
        policy.learn();

        PolicyCheckpointer checkpointer = new PolicyCheckpointer(dir.resolve("ckpt"));
        checkpointer.save("dqn", policy.getState());

        assertTrue(Files.isRegularFile(dir.resolve("ckpt").resolve("dqn")));
        Optional<PolicyState> loaded = checkpointer.load("dqn");
        assertTrue(loaded.isPresent());
        assertEquals(1, loaded.get().getLearnSteps());
        assertArrayEquals(new double[] {6.0}, loaded.get().getWeights().get("reward_sum"));
    }

    @Test
    void testMissingCheckpointIsSkipped() {
        CountingPolicy saved = new CountingPolicy("saved");
        saved.getExperienceStore().put(Batches.of(1, 1.0));
        saved.learn();
        PolicyCheckpointer checkpointer = new PolicyCheckpointer(dir);
        checkpointer.save("saved", saved.getState());

        Map<String, CountingPolicy> policies = new LinkedHashMap<>();
        policies.put("saved", new CountingPolicy("saved"));
        policies.put("missing", new CountingPolicy("missing"));
        checkpointer.loadInto(policies);

        assertEquals(1, policies.get("saved").getLearnSteps());
        assertEquals(0, policies.get("missing").getLearnSteps());
        assertFalse(checkpointer.load("missing").isPresent());
    }
}
