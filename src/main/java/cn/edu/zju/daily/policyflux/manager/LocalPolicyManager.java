package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import cn.edu.zju.daily.policyflux.policy.TrainablePolicy;
import cn.edu.zju.daily.policyflux.trainer.TrainerTracker;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Policy manager that owns the policy instances and trains them in the caller's thread. Any
 * exception from {@code learn()} propagates to the caller of {@link #update} and the round is not
 * recorded. Policies of that round that did learn are recorded with the next successful round.
 */
@Slf4j
public class LocalPolicyManager extends AbstractPolicyManager {

    public static final String LOCAL_TRAINER_ID = "LOCAL";

    /**
     * Policies that learned but whose new state has not been committed yet, because a later
     * policy of the same round failed. They are reported with the next committed round.
     */
    private final Set<String> uncommitted = new LinkedHashSet<>();

    public LocalPolicyManager(Map<String, ? extends Policy> policies, ManagerOptions options) {
        super(policies, List.of(LOCAL_TRAINER_ID), options);
    }

    @Override
    protected RoundResult runRound(int version, Map<String, ExperienceBatch> experienceByPolicy) {
        TrainerTracker tracker = new TrainerTracker(LOCAL_TRAINER_ID, version);

        for (Map.Entry<String, ExperienceBatch> exp : experienceByPolicy.entrySet()) {
            String name = exp.getKey();
            TrainablePolicy policy = policies.get(name);
            PolicyEntry entry = registry.get(name);

            policy.getExperienceStore().put(exp.getValue());
            entry.record(exp.getValue().size());
            if (entry.isDue(policy.getExperienceStore().size())) {
                long start = System.currentTimeMillis();
                boolean learned = policy.learn();
                tracker.record(
                        name, learned, System.currentTimeMillis() - start, policy.getTracker());
                entry.resetNewExperience();
                uncommitted.add(name);
            }
        }

        Set<String> updated = new LinkedHashSet<>(uncommitted);
        Map<String, PolicyState> states = new LinkedHashMap<>();
        for (String name : updated) {
            states.put(name, policies.get(name).getState().copy());
        }
        uncommitted.clear();
        return new RoundResult(updated, states, List.of(tracker));
    }

    @Override
    protected void shutdown() {
        LOG.debug("Local policy manager has no trainers to stop");
    }
}
