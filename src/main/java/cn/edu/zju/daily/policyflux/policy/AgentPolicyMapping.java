package cn.edu.zju.daily.policyflux.policy;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.manager.PolicyConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps agents to the policies that act for them. Several agents may share a policy, in which case
 * their experience is merged before it reaches the policy manager.
 */
public class AgentPolicyMapping {

    private final Map<String, Policy> policies;
    private final Map<String, String> agentToPolicy;

    public AgentPolicyMapping(Map<String, ? extends Policy> policies, Map<String, String> agentToPolicy) {
        for (Map.Entry<String, String> entry : agentToPolicy.entrySet()) {
            if (!policies.containsKey(entry.getValue())) {
                throw new PolicyConfigurationException(
                        "Agent "
                                + entry.getKey()
                                + " is mapped to unknown policy "
                                + entry.getValue()
                                + ", expected one of "
                                + policies.keySet());
            }
        }
        this.policies = new LinkedHashMap<>(policies);
        this.agentToPolicy = new LinkedHashMap<>(agentToPolicy);
    }

    public String getPolicyName(String agentId) {
        String policyName = agentToPolicy.get(agentId);
        if (policyName == null) {
            throw new IllegalArgumentException("Unknown agent " + agentId);
        }
        return policyName;
    }

    public Map<String, double[]> chooseAction(Map<String, double[]> stateByAgent) {
        Map<String, double[]> actions = new LinkedHashMap<>();
        stateByAgent.forEach(
                (agentId, state) ->
                        actions.put(agentId, policies.get(getPolicyName(agentId)).chooseAction(state)));
        return actions;
    }

    /**
     * Merges per-agent batches into per-policy batches. Batches of agents sharing a policy are
     * concatenated in the iteration order of {@code experienceByAgent}.
     */
    public Map<String, ExperienceBatch> groupByPolicy(Map<String, ExperienceBatch> experienceByAgent) {
        Map<String, ExperienceBatch> byPolicy = new LinkedHashMap<>();
        experienceByAgent.forEach(
                (agentId, batch) ->
                        byPolicy.computeIfAbsent(getPolicyName(agentId), k -> new ExperienceBatch())
                                .extend(batch));
        return byPolicy;
    }
}
