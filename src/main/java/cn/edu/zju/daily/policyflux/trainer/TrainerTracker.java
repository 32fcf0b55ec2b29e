package cn.edu.zju.daily.policyflux.trainer;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Diagnostics collected by one trainer unit during one update round. */
@Data
@NoArgsConstructor
public class TrainerTracker implements Serializable {

    private String trainerId;

    /** The manager version this round will produce. */
    private int round;

    /** Return value of {@code learn()} per policy. */
    private Map<String, Boolean> learnResults = new LinkedHashMap<>();

    private Map<String, Long> learnMillis = new LinkedHashMap<>();

    /** Policy-specific diagnostics, as reported by the policies themselves. */
    private Map<String, Map<String, Object>> diagnostics = new LinkedHashMap<>();

    public TrainerTracker(String trainerId, int round) {
        this.trainerId = trainerId;
        this.round = round;
    }

    public void record(
            String policyName, boolean learned, long millis, Map<String, Object> policyTracker) {
        learnResults.put(policyName, learned);
        learnMillis.put(policyName, millis);
        if (!policyTracker.isEmpty()) {
            diagnostics.put(policyName, new LinkedHashMap<>(policyTracker));
        }
    }
}
