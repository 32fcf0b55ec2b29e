package cn.edu.zju.daily.policyflux.trainer;

import cn.edu.zju.daily.policyflux.policy.PolicyFactory;
import cn.edu.zju.daily.policyflux.policy.TrainablePolicy;
import java.util.LinkedHashMap;
import java.util.Map;

/** Starts the execution context of one trainer unit. */
public interface TrainerLauncher {

    /**
     * Starts a trainer unit hosting the given policies.
     *
     * @param trainerId identifier of the trainer unit
     * @param policyFactories policy name to the class name of its {@link PolicyFactory}
     * @return the manager's end of the connection
     */
    TrainerChannel launch(String trainerId, Map<String, String> policyFactories);

    /** Instantiates the policies of a trainer unit from their factory class names. */
    static Map<String, TrainablePolicy> createPolicies(Map<String, String> policyFactories) {
        Map<String, TrainablePolicy> policies = new LinkedHashMap<>();
        policyFactories.forEach(
                (name, factoryClass) ->
                        policies.put(name, PolicyFactory.forClassName(factoryClass).create(name)));
        return policies;
    }
}
