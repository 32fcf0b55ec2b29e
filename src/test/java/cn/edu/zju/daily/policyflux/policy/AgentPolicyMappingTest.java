package cn.edu.zju.daily.policyflux.policy;

import static org.junit.jupiter.api.Assertions.*;

import cn.edu.zju.daily.policyflux.experience.Batches;
import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.manager.PolicyConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentPolicyMappingTest {

    private static Map<String, Policy> policies() {
        Map<String, Policy> policies = new LinkedHashMap<>();
        policies.put("dqn", new CountingPolicy("dqn"));
        policies.put("ac", new CountingPolicy("ac"));
        return policies;
    }

    @Test
    void testGroupByPolicyMergesSharedPolicies() {
        Map<String, String> agentToPolicy = new LinkedHashMap<>();
        agentToPolicy.put("port.0", "dqn");
        agentToPolicy.put("port.1", "ac");
        agentToPolicy.put("port.2", "dqn");
        AgentPolicyMapping mapping = new AgentPolicyMapping(policies(), agentToPolicy);

        Map<String, ExperienceBatch> byAgent = new LinkedHashMap<>();
        byAgent.put("port.0", Batches.of(2, 1.0));
        byAgent.put("port.1", Batches.of(4, 1.0));
        byAgent.put("port.2", Batches.of(3, 5.0));

        Map<String, ExperienceBatch> byPolicy = mapping.groupByPolicy(byAgent);

        assertEquals(2, byPolicy.size());
        assertEquals(5, byPolicy.get("dqn").size());
        assertEquals(5.0, byPolicy.get("dqn").getTransitions().get(4).getReward());
        assertEquals(4, byPolicy.get("ac").size());
    }

    @Test
    void testChooseActionUsesMappedPolicy() {
        AgentPolicyMapping mapping = new AgentPolicyMapping(policies(), Map.of("a", "ac"));
        Map<String, double[]> actions = mapping.chooseAction(Map.of("a", new double[] {1}));
        assertArrayEquals(new double[] {0}, actions.get("a"));
        assertThrows(
                IllegalArgumentException.class,
                () -> mapping.chooseAction(Map.of("b", new double[] {1})));
    }

    @Test
    void testUnknownPolicyIsRejected() {
        assertThrows(
                PolicyConfigurationException.class,
                () -> new AgentPolicyMapping(policies(), Map.of("a", "ppo")));
    }
}
