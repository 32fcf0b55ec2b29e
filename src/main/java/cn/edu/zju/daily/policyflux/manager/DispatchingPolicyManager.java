package cn.edu.zju.daily.policyflux.manager;

import static cn.edu.zju.daily.policyflux.trainer.TrainerFailureException.Cause.ERROR_REPLY;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import cn.edu.zju.daily.policyflux.trainer.MessageType;
import cn.edu.zju.daily.policyflux.trainer.TrainerFailureException;
import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import cn.edu.zju.daily.policyflux.trainer.TrainerTracker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Base of the managers whose policies live in trainer units outside the manager. Experience is
 * cached per policy and shipped to the owning trainer once the policy is due; every round sends
 * one {@code LEARN} message to each trainer and waits until all of them have replied.
 *
 * <p>If a round fails the manager refuses further rounds: a late reply would otherwise be taken
 * for the answer to the next request.
 */
@Slf4j
public abstract class DispatchingPolicyManager extends AbstractPolicyManager {

    private final Duration roundTimeout;

    protected DispatchingPolicyManager(
            Map<String, ? extends Policy> policies,
            List<String> trainerPool,
            ManagerOptions options) {
        super(policies, trainerPool, options);
        this.roundTimeout = options.getRoundTimeout();
    }

    protected abstract void send(String trainerId, TrainerMessage message);

    /**
     * Receives exactly one reply from each of the given trainers.
     *
     * @return replies keyed by trainer id
     * @throws TrainerFailureException if a trainer died or the deadline passed
     */
    protected abstract Map<String, TrainerMessage> receiveReplies(
            List<String> trainerIds, RoundDeadline deadline);

    protected abstract void closeTransport();

    /** Sends each trainer the initial state of its policies and waits for the acknowledgments. */
    protected void initializeTrainers() {
        List<String> trainerIds = registry.trainerIds();
        for (String trainerId : trainerIds) {
            Map<String, PolicyState> states = new LinkedHashMap<>();
            for (String name : registry.policiesOf(trainerId)) {
                states.put(name, latestStates().get(name));
            }
            send(trainerId, TrainerMessage.init(states));
        }
        Map<String, TrainerMessage> replies =
                receiveReplies(trainerIds, RoundDeadline.start(roundTimeout));
        for (String trainerId : trainerIds) {
            expect(trainerId, replies.get(trainerId), MessageType.INIT_ACK);
            LOG.info("{} initialized policies {}", trainerId, registry.policiesOf(trainerId));
        }
    }

    @Override
    protected RoundResult runRound(int version, Map<String, ExperienceBatch> experienceByPolicy) {
        List<String> trainerIds = registry.trainerIds();
        Map<String, Map<String, ExperienceBatch>> outgoing = new LinkedHashMap<>();
        for (String trainerId : trainerIds) {
            outgoing.put(trainerId, new LinkedHashMap<>());
        }

        Set<String> updated = new LinkedHashSet<>();
        for (Map.Entry<String, ExperienceBatch> exp : experienceByPolicy.entrySet()) {
            PolicyEntry entry = registry.get(exp.getKey());
            entry.accumulate(exp.getValue());
            if (entry.isDue(entry.getTotalExperience())) {
                outgoing.get(entry.getTrainerId()).put(entry.getName(), entry.takePending());
                updated.add(entry.getName());
            }
        }

        try {
            for (String trainerId : trainerIds) {
                send(trainerId, TrainerMessage.learn(outgoing.get(trainerId)));
            }
            Map<String, TrainerMessage> replies =
                    receiveReplies(trainerIds, RoundDeadline.start(roundTimeout));

            Map<String, PolicyState> states = new LinkedHashMap<>();
            List<TrainerTracker> trackers = new ArrayList<>();
            for (String trainerId : trainerIds) {
                TrainerMessage reply = replies.get(trainerId);
                expect(trainerId, reply, MessageType.LEARN_RESULT);
                for (Map.Entry<String, PolicyState> state : reply.getPolicyStates().entrySet()) {
                    if (!registry.contains(state.getKey())
                            || !trainerId.equals(registry.trainerOf(state.getKey()))) {
                        throw new TrainerFailureException(
                                trainerId,
                                ERROR_REPLY,
                                "returned state of policy " + state.getKey() + " it does not own");
                    }
                    states.put(state.getKey(), state.getValue());
                }
                trackers.add(reply.getTracker());
            }
            for (String name : updated) {
                if (!states.containsKey(name)) {
                    throw new TrainerFailureException(
                            registry.trainerOf(name),
                            ERROR_REPLY,
                            "did not return the state of updated policy " + name);
                }
            }
            return new RoundResult(updated, states, trackers);
        } catch (TrainerFailureException e) {
            markBroken(e.getMessage());
            throw e;
        }
    }

    private static void expect(String trainerId, TrainerMessage reply, MessageType type) {
        if (reply.getType() == MessageType.ERROR) {
            throw new TrainerFailureException(trainerId, ERROR_REPLY, reply.getError());
        }
        if (reply.getType() != type) {
            throw new TrainerFailureException(
                    trainerId, ERROR_REPLY, "expected " + type + " but got " + reply.getType());
        }
    }

    @Override
    protected void shutdown() {
        try {
            for (String trainerId : registry.trainerIds()) {
                try {
                    send(trainerId, TrainerMessage.exit());
                } catch (TrainerFailureException e) {
                    LOG.warn("Could not tell {} to exit: {}", trainerId, e.getMessage());
                }
            }
        } finally {
            closeTransport();
        }
    }
}
