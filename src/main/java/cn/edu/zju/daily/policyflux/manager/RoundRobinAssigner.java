package cn.edu.zju.daily.policyflux.manager;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Statically assigns policies to trainers: the i-th policy goes to {@code pool[i mod K]}. */
public class RoundRobinAssigner {

    public static Map<String, String> assign(List<String> policyNames, List<String> trainerPool) {
        if (trainerPool.isEmpty()) {
            throw new PolicyConfigurationException("The trainer pool is empty");
        }
        Map<String, String> assignment = new LinkedHashMap<>();
        for (int i = 0; i < policyNames.size(); i++) {
            assignment.put(policyNames.get(i), trainerPool.get(i % trainerPool.size()));
        }
        return assignment;
    }
}
