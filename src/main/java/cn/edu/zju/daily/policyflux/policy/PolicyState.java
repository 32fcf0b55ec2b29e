package cn.edu.zju.daily.policyflux.policy;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a policy's model: weights, optimizer state and the number of learning steps taken.
 * The manager never interprets the arrays, it only stores and forwards them.
 */
@Data
@NoArgsConstructor
public class PolicyState implements Serializable {

    private Map<String, double[]> weights = new HashMap<>();
    private Map<String, double[]> optimizerState = new HashMap<>();
    private long learnSteps;

    public PolicyState(
            Map<String, double[]> weights, Map<String, double[]> optimizerState, long learnSteps) {
        this.weights = weights;
        this.optimizerState = optimizerState;
        this.learnSteps = learnSteps;
    }

    /** Deep copy, so that a snapshot cannot change under a reader. */
    public PolicyState copy() {
        return new PolicyState(copyArrays(weights), copyArrays(optimizerState), learnSteps);
    }

    private static Map<String, double[]> copyArrays(Map<String, double[]> arrays) {
        Map<String, double[]> copy = new HashMap<>();
        arrays.forEach((name, values) -> copy.put(name, values.clone()));
        return copy;
    }
}
