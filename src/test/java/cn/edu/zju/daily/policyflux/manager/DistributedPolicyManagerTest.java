package cn.edu.zju.daily.policyflux.manager;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.policyflux.experience.Batches;
import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.CountingPolicy;
import cn.edu.zju.daily.policyflux.policy.PolicyFactory;
import cn.edu.zju.daily.policyflux.policy.StubPolicyFactories;
import cn.edu.zju.daily.policyflux.trainer.TrainerFailureException;
import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import cn.edu.zju.daily.policyflux.trainer.TrainerUnit;
import cn.edu.zju.daily.policyflux.transport.Envelope;
import cn.edu.zju.daily.policyflux.transport.InMemoryMessageBus;
import cn.edu.zju.daily.policyflux.transport.ManagerEndpoint;
import cn.edu.zju.daily.policyflux.transport.TrainerNode;
import cn.edu.zju.daily.policyflux.utils.ThreadUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DistributedPolicyManagerTest {

    private final List<Thread> nodes = new ArrayList<>();

    private static Map<String, CountingPolicy> policies(String... names) {
        Map<String, CountingPolicy> policies = new LinkedHashMap<>();
        for (String name : names) {
            policies.put(name, new CountingPolicy(name));
        }
        return policies;
    }

    private void startNode(InMemoryMessageBus bus, String name) {
        startNode(bus, name, new TrainerUnit(name, CountingPolicy::new));
    }

    private void startNode(InMemoryMessageBus bus, String name, TrainerUnit unit) {
        nodes.add(
                ThreadUtils.startDaemon(
                        "node-" + name, new TrainerNode(unit, bus.trainerEndpoint(name))));
    }

    @AfterEach
    void joinNodes() throws InterruptedException {
        for (Thread node : nodes) {
            node.join(5000);
        }
    }

    @Test
    void testTrainsOnRemoteNodes() throws InterruptedException {
        InMemoryMessageBus bus = new InMemoryMessageBus("GROUP", 2);
        for (String name : bus.getTrainerNames()) {
            startNode(bus, name);
        }
        DistributedPolicyManager manager =
                new DistributedPolicyManager(
                        policies("a", "b", "c"),
                        bus.managerEndpoint(),
                        ManagerOptions.defaults().roundTimeout(Duration.ofSeconds(10)));

        assertEquals("GROUP.TRAINER.0", manager.getRegistry().trainerOf("a"));
        assertEquals("GROUP.TRAINER.1", manager.getRegistry().trainerOf("b"));
        assertEquals("GROUP.TRAINER.0", manager.getRegistry().trainerOf("c"));

        Map<String, ExperienceBatch> exp = new LinkedHashMap<>();
        exp.put("a", Batches.of(2, 1.0));
        exp.put("b", Batches.of(1, 4.0));
        manager.update(exp);
        manager.update(Map.of("c", Batches.of(3, 1.0)));

        assertEquals(2, manager.getVersion());
        assertEquals(Set.of("c"), manager.getState().keySet());
        assertEquals(Set.of("a", "b", "c"), manager.getState(0).keySet());
        assertArrayEquals(
                new double[] {4.0}, manager.getState(0).get("b").getWeights().get("reward_sum"));

        manager.exit();
        for (Thread node : nodes) {
            node.join(5000);
            assertFalse(node.isAlive());
        }
    }

    @Test
    void testSilentNodeTimesOut() {
        InMemoryMessageBus bus = new InMemoryMessageBus("GROUP", 2);
        startNode(bus, "GROUP.TRAINER.0");

        TrainerFailureException e =
                assertThrows(
                        TrainerFailureException.class,
                        () ->
                                new DistributedPolicyManager(
                                        policies("a", "b"),
                                        bus.managerEndpoint(),
                                        ManagerOptions.defaults()
                                                .roundTimeout(Duration.ofMillis(300))));
        assertEquals(TrainerFailureException.Cause.TIMED_OUT, e.getFailure());
        assertEquals("GROUP.TRAINER.1", e.getTrainerId());

        nodes.forEach(Thread::interrupt);
    }

    @Test
    void testRejectsEndpointWithoutWorkers() {
        ManagerEndpoint empty =
                new ManagerEndpoint() {
                    @Override
                    public String getGroup() {
                        return "EMPTY";
                    }

                    @Override
                    public List<String> getWorkers() {
                        return Collections.emptyList();
                    }

                    @Override
                    public void send(String destination, TrainerMessage message) {
                        fail("nothing to send to");
                    }

                    @Override
                    public Envelope receive(Duration timeout) {
                        return null;
                    }

                    @Override
                    public void close() {}
                };
        PolicyConfigurationException e =
                assertThrows(
                        PolicyConfigurationException.class,
                        () ->
                                new DistributedPolicyManager(
                                        policies("a"), empty, ManagerOptions.defaults()));
        assertTrue(e.getMessage().contains("EMPTY"));
    }

    @Test
    void testUpdateAfterExitFails() throws InterruptedException {
        InMemoryMessageBus bus = new InMemoryMessageBus("GROUP", 2);
        for (String name : bus.getTrainerNames()) {
            startNode(bus, name);
        }
        DistributedPolicyManager manager =
                new DistributedPolicyManager(
                        policies("a", "b"),
                        bus.managerEndpoint(),
                        ManagerOptions.defaults().roundTimeout(Duration.ofSeconds(10)));
        manager.update(Map.of("a", Batches.of(1, 1.0)));
        manager.exit();

        assertTimeoutPreemptively(
                Duration.ofSeconds(5),
                () -> {
                    assertThrows(
                            ManagerClosedException.class,
                            () -> manager.update(Map.of("a", Batches.of(1, 1.0))));
                    assertThrows(ManagerClosedException.class, manager::exit);
                });
        assertEquals(1, manager.getVersion());
        for (Thread node : nodes) {
            node.join(5000);
            assertFalse(node.isAlive());
        }
    }

    @Test
    void testErrorReplyFailsRoundAndBreaksManager() throws InterruptedException {
        InMemoryMessageBus bus = new InMemoryMessageBus("GROUP", 2);
        startNode(bus, "GROUP.TRAINER.0");
        PolicyFactory failing = new StubPolicyFactories.Failing();
        startNode(bus, "GROUP.TRAINER.1", new TrainerUnit("GROUP.TRAINER.1", failing::create));
        DistributedPolicyManager manager =
                new DistributedPolicyManager(
                        policies("a", "b"),
                        bus.managerEndpoint(),
                        ManagerOptions.defaults().roundTimeout(Duration.ofSeconds(10)));

        Map<String, ExperienceBatch> exp = new LinkedHashMap<>();
        exp.put("a", Batches.of(1, 1.0));
        exp.put("b", Batches.of(1, 1.0));
        TrainerFailureException e =
                assertThrows(TrainerFailureException.class, () -> manager.update(exp));
        assertEquals(TrainerFailureException.Cause.ERROR_REPLY, e.getFailure());
        assertEquals("GROUP.TRAINER.1", e.getTrainerId());
        assertTrue(e.getMessage().contains("diverged"));
        assertEquals(0, manager.getVersion());
        assertEquals(0, manager.getState(-1).get("a").getLearnSteps());

        assertThrows(ManagerClosedException.class, () -> manager.update(Map.of()));
        manager.exit();
        for (Thread node : nodes) {
            node.join(5000);
            assertFalse(node.isAlive());
        }
    }
}
