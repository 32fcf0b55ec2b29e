package cn.edu.zju.daily.policyflux.manager;

import static cn.edu.zju.daily.policyflux.trainer.TrainerFailureException.Cause.TIMED_OUT;

import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.trainer.TrainerFailureException;
import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import cn.edu.zju.daily.policyflux.transport.Envelope;
import cn.edu.zju.daily.policyflux.transport.ManagerEndpoint;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Policy manager that trains policies on remote trainer nodes reached through a {@link
 * ManagerEndpoint}. Policies are assigned round-robin over the endpoint's workers. Replies are
 * matched to trainers by sender, in whatever order they arrive.
 *
 * <p>A lost node cannot be told apart from a slow one; without a round timeout such a round
 * blocks forever.
 */
@Slf4j
public class DistributedPolicyManager extends DispatchingPolicyManager {

    private final ManagerEndpoint endpoint;

    public DistributedPolicyManager(
            Map<String, ? extends Policy> policies,
            ManagerEndpoint endpoint,
            ManagerOptions options) {
        super(policies, workersOf(endpoint), options);
        this.endpoint = endpoint;
        try {
            initializeTrainers();
        } catch (RuntimeException e) {
            endpoint.close();
            throw e;
        }
    }

    private static List<String> workersOf(ManagerEndpoint endpoint) {
        if (endpoint.getWorkers().isEmpty()) {
            throw new PolicyConfigurationException(
                    "Endpoint of group " + endpoint.getGroup() + " has no trainer nodes");
        }
        return endpoint.getWorkers();
    }

    @Override
    protected void send(String trainerId, TrainerMessage message) {
        endpoint.send(trainerId, message);
    }

    @Override
    protected Map<String, TrainerMessage> receiveReplies(
            List<String> trainerIds, RoundDeadline deadline) {
        Map<String, TrainerMessage> replies = new LinkedHashMap<>();
        Set<String> waiting = new LinkedHashSet<>(trainerIds);
        while (!waiting.isEmpty()) {
            Envelope envelope = endpoint.receive(deadline.remaining());
            if (envelope == null) {
                throw new TrainerFailureException(
                        String.join(",", waiting), TIMED_OUT, "no reply before the round deadline");
            }
            if (!waiting.remove(envelope.getSender())) {
                LOG.warn(
                        "Ignoring {} from {}, which is not expected to reply",
                        envelope.getMessage().getType(),
                        envelope.getSender());
                continue;
            }
            replies.put(envelope.getSender(), envelope.getMessage());
        }
        return replies;
    }

    @Override
    protected void closeTransport() {
        endpoint.close();
    }
}
