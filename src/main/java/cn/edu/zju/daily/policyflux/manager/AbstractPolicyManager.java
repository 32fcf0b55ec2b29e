package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.policy.PolicyCheckpointer;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import cn.edu.zju.daily.policyflux.policy.TrainablePolicy;
import cn.edu.zju.daily.policyflux.trainer.TrainerTracker;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bookkeeping shared by all policy managers: the policy registry, the version history and the
 * cache of the latest known policy states. Subclasses only decide how a round is executed.
 *
 * <p>History and state cache are published together as one immutable snapshot at the end of a
 * round, which is what lets {@link #getState} run concurrently with {@link #update}.
 */
@Slf4j
public abstract class AbstractPolicyManager implements PolicyManager {

    protected final Map<String, TrainablePolicy> policies;
    protected final PolicyRegistry registry;

    private final Consumer<List<TrainerTracker>> postUpdate;
    private final PolicyCheckpointer checkpointer;
    private final int checkpointEvery;

    private volatile Snapshot snapshot;
    private volatile boolean exited = false;
    private volatile String brokenReason;

    /**
     * @param policies managed policies; their iteration order drives trainer assignment
     * @param trainerPool trainers to assign policies to, round-robin
     * @throws PolicyConfigurationException if a policy is not trainable
     */
    protected AbstractPolicyManager(
            Map<String, ? extends Policy> policies,
            List<String> trainerPool,
            ManagerOptions options) {
        this.policies = checkTrainable(policies);
        if (options.getLoadDir() != null) {
            new PolicyCheckpointer(options.getLoadDir()).loadInto(this.policies);
        }
        this.registry =
                new PolicyRegistry(
                        RoundRobinAssigner.assign(
                                new ArrayList<>(this.policies.keySet()), trainerPool),
                        options.getUpdateTrigger(),
                        options.getWarmup());
        this.postUpdate = options.getPostUpdate();
        this.checkpointer =
                options.getCheckpointDir() == null
                        ? null
                        : new PolicyCheckpointer(options.getCheckpointDir());
        this.checkpointEvery = options.getCheckpointEvery();

        Map<String, PolicyState> states = new LinkedHashMap<>();
        this.policies.forEach((name, policy) -> states.put(name, policy.getState().copy()));
        this.snapshot =
                new Snapshot(
                        VersionHistory.initial(this.policies.keySet()),
                        Collections.unmodifiableMap(states));
    }

    private static Map<String, TrainablePolicy> checkTrainable(
            Map<String, ? extends Policy> policies) {
        Map<String, TrainablePolicy> trainables = new LinkedHashMap<>();
        policies.forEach(
                (name, policy) -> {
                    if (!(policy instanceof TrainablePolicy)) {
                        throw new PolicyConfigurationException(
                                "Only trainable policies can be managed by a policy manager, "
                                        + "but policy "
                                        + name
                                        + " is a "
                                        + (policy == null ? "null" : policy.getClass().getName()));
                    }
                    trainables.put(name, (TrainablePolicy) policy);
                });
        return trainables;
    }

    @Override
    public final void update(Map<String, ExperienceBatch> experienceByPolicy) {
        ensureOpen();
        for (String name : experienceByPolicy.keySet()) {
            registry.get(name);
        }

        long start = System.currentTimeMillis();
        Snapshot current = snapshot;
        int version = current.history.version() + 1;
        RoundResult result = runRound(version, experienceByPolicy);

        Map<String, PolicyState> states = new LinkedHashMap<>(current.states);
        states.putAll(result.getStates());
        snapshot =
                new Snapshot(
                        current.history.append(result.getUpdated()),
                        Collections.unmodifiableMap(states));

        if (!result.getUpdated().isEmpty()) {
            LOG.info("Version {}: updated policies {}", version, result.getUpdated());
        }
        if (checkpointer != null && checkpointEvery > 0 && version % checkpointEvery == 0) {
            checkpoint(version);
        }
        if (postUpdate != null) {
            postUpdate.accept(result.getTrackers());
        }
        LOG.debug("Version {}: policy update time {} ms", version, System.currentTimeMillis() - start);
    }

    /**
     * Executes one round. Must not touch the version history or the state cache: the caller
     * commits the result only if this method returns normally.
     *
     * @param version the version this round will produce
     */
    protected abstract RoundResult runRound(
            int version, Map<String, ExperienceBatch> experienceByPolicy);

    private void checkpoint(int version) {
        Set<String> changed = snapshot.history.updatedSince(version - checkpointEvery);
        Map<String, PolicyState> states = new LinkedHashMap<>();
        for (String name : changed) {
            states.put(name, snapshot.states.get(name));
        }
        checkpointer.saveAll(states);
        LOG.info("Version {}: checkpointed policies {}", version, changed);
    }

    @Override
    public Map<String, PolicyState> getState(int sinceVersion) {
        Snapshot current = snapshot;
        Map<String, PolicyState> result = new LinkedHashMap<>();
        for (String name : current.history.updatedSince(sinceVersion)) {
            result.put(name, current.states.get(name).copy());
        }
        return result;
    }

    @Override
    public int getVersion() {
        return snapshot.history.version();
    }

    /** The version history as of the last completed round. */
    public VersionHistory getHistory() {
        return snapshot.history;
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }

    /** Latest known state of every policy, not copied. */
    protected Map<String, PolicyState> latestStates() {
        return snapshot.states;
    }

    @Override
    public final synchronized void exit() {
        if (exited) {
            throw new ManagerClosedException(getClass().getSimpleName() + " has already exited");
        }
        exited = true;
        shutdown();
        LOG.info("Exiting...");
    }

    /** Releases trainers and transports. Called once, by {@link #exit()}. */
    protected abstract void shutdown();

    /** Refuses all further rounds, e.g. after trainers stopped answering in order. */
    protected void markBroken(String reason) {
        brokenReason = reason;
        LOG.error("{} can no longer run update rounds: {}", getClass().getSimpleName(), reason);
    }

    private void ensureOpen() {
        if (exited) {
            throw new ManagerClosedException(getClass().getSimpleName() + " has exited");
        }
        if (brokenReason != null) {
            throw new ManagerClosedException(
                    getClass().getSimpleName() + " failed a previous round: " + brokenReason);
        }
    }

    @AllArgsConstructor
    private static final class Snapshot {
        private final VersionHistory history;
        private final Map<String, PolicyState> states;
    }

    /** What one round produced. */
    @Getter
    @AllArgsConstructor
    protected static class RoundResult {
        private final Set<String> updated;
        private final Map<String, PolicyState> states;
        private final List<TrainerTracker> trackers;
    }
}
