package cn.edu.zju.daily.policyflux.trainer;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import cn.edu.zju.daily.policyflux.policy.TrainablePolicy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Hosts a disjoint subset of the managed policies and answers the trainer protocol for them. The
 * unit itself is transport-agnostic: {@link TrainerLoop} and {@link
 * cn.edu.zju.daily.policyflux.transport.TrainerNode} feed it messages from a pipe or an endpoint.
 *
 * <p>Not thread-safe. Messages must be handled one at a time, which the strict request/response
 * protocol guarantees.
 */
@Slf4j
public class TrainerUnit {

    @Getter private final String trainerId;
    private final Map<String, TrainablePolicy> policies;
    private final Function<String, TrainablePolicy> policyCreator;
    private int rounds = 0;
    @Getter private boolean exited = false;

    public TrainerUnit(String trainerId, Map<String, ? extends TrainablePolicy> policies) {
        this.trainerId = trainerId;
        this.policies = new LinkedHashMap<>(policies);
        this.policyCreator = null;
    }

    /**
     * A unit that learns which policies it hosts from the {@code INIT_POLICY_STATE} message, as
     * remote nodes do: the policies are created on first initialization.
     */
    public TrainerUnit(String trainerId, Function<String, TrainablePolicy> policyCreator) {
        this.trainerId = trainerId;
        this.policies = new LinkedHashMap<>();
        this.policyCreator = policyCreator;
    }

    public Map<String, TrainablePolicy> getPolicies() {
        return Collections.unmodifiableMap(policies);
    }

    /**
     * Handles one message from the manager.
     *
     * @return the reply, or null for {@code EXIT}
     */
    public TrainerMessage handle(TrainerMessage message) {
        if (exited) {
            throw new IllegalStateException(trainerId + " has already exited");
        }
        switch (message.getType()) {
            case INIT_POLICY_STATE:
                return init(message.getPolicyStates());
            case LEARN:
                return learn(message.getExperiences());
            case EXIT:
                LOG.info("{} exiting", trainerId);
                exited = true;
                return null;
            default:
                return TrainerMessage.error(
                        trainerId, "Unexpected message type " + message.getType());
        }
    }

    private TrainerMessage init(Map<String, PolicyState> states) {
        for (Map.Entry<String, PolicyState> entry : states.entrySet()) {
            TrainablePolicy policy = policies.get(entry.getKey());
            if (policy == null && policyCreator != null) {
                policy = policyCreator.apply(entry.getKey());
                policies.put(entry.getKey(), policy);
            }
            if (policy == null) {
                return TrainerMessage.error(
                        trainerId, "Policy " + entry.getKey() + " is not hosted here");
            }
            policy.setState(entry.getValue());
        }
        LOG.info("{} initialized policies {}", trainerId, states.keySet());
        return TrainerMessage.initAck(trainerId);
    }

    private TrainerMessage learn(Map<String, ExperienceBatch> experiences) {
        rounds++;
        TrainerTracker tracker = new TrainerTracker(trainerId, rounds);
        Map<String, PolicyState> updated = new LinkedHashMap<>();
        for (Map.Entry<String, ExperienceBatch> entry : experiences.entrySet()) {
            String name = entry.getKey();
            ExperienceBatch batch = entry.getValue();
            if (batch == null || batch.isEmpty()) {
                continue;
            }
            TrainablePolicy policy = policies.get(name);
            if (policy == null) {
                return TrainerMessage.error(trainerId, "Policy " + name + " is not hosted here");
            }
            long start = System.currentTimeMillis();
            try {
                policy.getExperienceStore().put(batch);
                boolean learned = policy.learn();
                tracker.record(
                        name, learned, System.currentTimeMillis() - start, policy.getTracker());
                updated.put(name, policy.getState());
            } catch (RuntimeException e) {
                LOG.error("{} failed to update policy {}", trainerId, name, e);
                return TrainerMessage.error(
                        trainerId, "Policy " + name + " failed to learn: " + e);
            }
        }
        LOG.debug("{} round {} updated {}", trainerId, rounds, updated.keySet());
        return TrainerMessage.learnResult(trainerId, updated, tracker);
    }
}
