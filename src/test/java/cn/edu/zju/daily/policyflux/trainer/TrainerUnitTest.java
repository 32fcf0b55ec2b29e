package cn.edu.zju.daily.policyflux.trainer;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.policyflux.experience.Batches;
import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.CountingPolicy;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import cn.edu.zju.daily.policyflux.policy.StubPolicyFactories;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrainerUnitTest {

    private CountingPolicy a;
    private CountingPolicy b;
    private TrainerUnit unit;

    @BeforeEach
    void setUp() {
        a = new CountingPolicy("a");
        b = new CountingPolicy("b");
        Map<String, CountingPolicy> policies = new LinkedHashMap<>();
        policies.put("a", a);
        policies.put("b", b);
        unit = new TrainerUnit("TRAINER.0", policies);
    }

    @Test
    void testInitSetsStates() {
        PolicyState state = new CountingPolicy("a").getState();
        state.setLearnSteps(7);

        TrainerMessage reply = unit.handle(TrainerMessage.init(Map.of("a", state)));

        assertEquals(MessageType.INIT_ACK, reply.getType());
        assertEquals("TRAINER.0", reply.getTrainerId());
        assertEquals(7, a.getLearnSteps());
    }

    @Test
    void testLearnOnlyReportsTrainedPolicies() {
        Map<String, ExperienceBatch> experiences = new LinkedHashMap<>();
        experiences.put("a", Batches.of(2, 1.5));
        experiences.put("b", new ExperienceBatch());

        TrainerMessage reply = unit.handle(TrainerMessage.learn(experiences));

        assertEquals(MessageType.LEARN_RESULT, reply.getType());
        assertEquals(1L, reply.getPolicyStates().get("a").getLearnSteps());
        assertFalse(reply.getPolicyStates().containsKey("b"));
        assertEquals(0, b.getLearnSteps());
        assertEquals(Boolean.TRUE, reply.getTracker().getLearnResults().get("a"));
        assertEquals(2, reply.getTracker().getDiagnostics().get("a").get("memory_size"));
    }

    @Test
    void testLearnFailureBecomesErrorReply() {
        TrainerUnit failing =
                new TrainerUnit("TRAINER.1", name -> new StubPolicyFactories.Failing().create(name));
        failing.handle(TrainerMessage.init(Map.of("c", new CountingPolicy("c").getState())));

        TrainerMessage reply = failing.handle(TrainerMessage.learn(Map.of("c", Batches.of(1, 0))));

        assertEquals(MessageType.ERROR, reply.getType());
        assertTrue(reply.getError().contains("diverged"));
    }

    @Test
    void testUnknownPolicyIsAnError() {
        TrainerMessage reply = unit.handle(TrainerMessage.learn(Map.of("z", Batches.of(1, 0))));
        assertEquals(MessageType.ERROR, reply.getType());
    }

    @Test
    void testCreatesPoliciesOnInit() {
        TrainerUnit lazy = new TrainerUnit("node", CountingPolicy::new);
        lazy.handle(TrainerMessage.init(Map.of("x", new CountingPolicy("x").getState())));
        assertEquals(1, lazy.getPolicies().size());
        assertTrue(lazy.getPolicies().containsKey("x"));
    }

    @Test
    void testExit() {
        assertNull(unit.handle(TrainerMessage.exit()));
        assertTrue(unit.isExited());
        assertThrows(IllegalStateException.class, () -> unit.handle(TrainerMessage.exit()));
    }
}
