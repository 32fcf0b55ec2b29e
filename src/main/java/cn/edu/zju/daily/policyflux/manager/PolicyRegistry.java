package cn.edu.zju.daily.policyflux.manager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-policy bookkeeping of a manager: trainer assignment, thresholds and experience counters.
 * Assignment is fixed at construction.
 */
public class PolicyRegistry {

    private static final int DEFAULT_THRESHOLD = 1;

    private final Map<String, PolicyEntry> entries = new LinkedHashMap<>();
    private final Map<String, List<String>> policiesByTrainer = new LinkedHashMap<>();

    /**
     * @param assignment policy name to trainer id, in policy order
     * @param updateTrigger per-policy trigger; missing or non-positive values default to 1
     * @param warmup per-policy warmup; missing or non-positive values default to 1
     */
    public PolicyRegistry(
            Map<String, String> assignment,
            Map<String, Integer> updateTrigger,
            Map<String, Integer> warmup) {
        checkKnown("update trigger", updateTrigger, assignment);
        checkKnown("warmup", warmup, assignment);
        assignment.forEach(
                (name, trainerId) -> {
                    entries.put(
                            name,
                            new PolicyEntry(
                                    name,
                                    trainerId,
                                    threshold(updateTrigger, name),
                                    threshold(warmup, name)));
                    policiesByTrainer.computeIfAbsent(trainerId, k -> new ArrayList<>()).add(name);
                });
    }

    private static void checkKnown(
            String what, Map<String, Integer> thresholds, Map<String, String> assignment) {
        if (thresholds == null) {
            return;
        }
        for (String name : thresholds.keySet()) {
            if (!assignment.containsKey(name)) {
                throw new PolicyConfigurationException(
                        "The " + what + " refers to unknown policy " + name);
            }
        }
    }

    private static int threshold(Map<String, Integer> thresholds, String name) {
        if (thresholds == null) {
            return DEFAULT_THRESHOLD;
        }
        Integer value = thresholds.get(name);
        return value == null || value <= 0 ? DEFAULT_THRESHOLD : value;
    }

    public PolicyEntry get(String policyName) {
        PolicyEntry entry = entries.get(policyName);
        if (entry == null) {
            throw new IllegalArgumentException(
                    "Unknown policy " + policyName + ", expected one of " + entries.keySet());
        }
        return entry;
    }

    public boolean contains(String policyName) {
        return entries.containsKey(policyName);
    }

    public List<String> policyNames() {
        return new ArrayList<>(entries.keySet());
    }

    /** Trainers owning at least one policy, in assignment order. */
    public List<String> trainerIds() {
        return new ArrayList<>(policiesByTrainer.keySet());
    }

    public List<String> policiesOf(String trainerId) {
        return Collections.unmodifiableList(
                policiesByTrainer.getOrDefault(trainerId, Collections.emptyList()));
    }

    public String trainerOf(String policyName) {
        return get(policyName).getTrainerId();
    }
}
