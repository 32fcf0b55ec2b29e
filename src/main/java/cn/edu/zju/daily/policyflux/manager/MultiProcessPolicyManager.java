package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.trainer.TrainerChannel;
import cn.edu.zju.daily.policyflux.trainer.TrainerLauncher;
import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Policy manager that starts one trainer unit per trainer group, each connected through its own
 * duplex byte pipe. Trainers are named {@code TRAINER.<i>}; policies are assigned round-robin.
 * Trainer groups that would own no policy are not started.
 */
@Slf4j
public class MultiProcessPolicyManager extends DispatchingPolicyManager {

    private final Map<String, TrainerChannel> channels = new LinkedHashMap<>();

    /**
     * @param policies managed policies, used for their initial state
     * @param numTrainers number of trainer groups to spread the policies over
     * @param policyFactories policy name to the class name of the factory that recreates the
     *     policy inside its trainer
     * @param launcher starts the trainer units
     */
    public MultiProcessPolicyManager(
            Map<String, ? extends Policy> policies,
            int numTrainers,
            Map<String, String> policyFactories,
            TrainerLauncher launcher,
            ManagerOptions options) {
        super(policies, trainerPool(numTrainers), options);
        for (String name : registry.policyNames()) {
            if (!policyFactories.containsKey(name)) {
                throw new PolicyConfigurationException("No policy factory given for policy " + name);
            }
        }

        try {
            for (String trainerId : registry.trainerIds()) {
                Map<String, String> factories = new LinkedHashMap<>();
                for (String name : registry.policiesOf(trainerId)) {
                    factories.put(name, policyFactories.get(name));
                }
                channels.put(trainerId, launcher.launch(trainerId, factories));
            }
            initializeTrainers();
        } catch (RuntimeException e) {
            closeTransport();
            throw e;
        }
    }

    static List<String> trainerPool(int numTrainers) {
        if (numTrainers < 1) {
            throw new PolicyConfigurationException(
                    "numTrainers must be positive, got " + numTrainers);
        }
        List<String> pool = new ArrayList<>(numTrainers);
        for (int i = 0; i < numTrainers; i++) {
            pool.add("TRAINER." + i);
        }
        return pool;
    }

    @Override
    protected void send(String trainerId, TrainerMessage message) {
        channels.get(trainerId).send(message);
    }

    @Override
    protected Map<String, TrainerMessage> receiveReplies(
            List<String> trainerIds, RoundDeadline deadline) {
        Map<String, TrainerMessage> replies = new LinkedHashMap<>();
        for (String trainerId : trainerIds) {
            replies.put(trainerId, channels.get(trainerId).receive(deadline.remaining()));
        }
        return replies;
    }

    @Override
    protected void closeTransport() {
        for (TrainerChannel channel : channels.values()) {
            channel.close();
        }
        LOG.info("Closed channels to {}", channels.keySet());
    }
}
