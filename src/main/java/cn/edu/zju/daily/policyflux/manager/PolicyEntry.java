package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import lombok.Getter;

/** Registry record of one managed policy. */
@Getter
public class PolicyEntry {

    private final String name;
    private final String trainerId;
    private final int trigger;
    private final int warmup;

    /** Experience received since the last update of this policy. */
    private int newExperience = 0;

    /** Experience received over the lifetime of the manager. */
    private long totalExperience = 0;

    /** Experience waiting to be shipped to the trainer; only used by dispatching managers. */
    private ExperienceBatch pending = new ExperienceBatch();

    PolicyEntry(String name, String trainerId, int trigger, int warmup) {
        this.name = name;
        this.trainerId = trainerId;
        this.trigger = trigger;
        this.warmup = warmup;
    }

    /** Counts experience that went straight into the policy's own store. */
    void record(int size) {
        newExperience += size;
        totalExperience += size;
    }

    /** Counts experience and keeps it until the policy is due. */
    void accumulate(ExperienceBatch batch) {
        record(batch.size());
        pending.extend(batch);
    }

    boolean isDue(long availableExperience) {
        return newExperience >= trigger && availableExperience >= warmup;
    }

    /** Hands over the pending batch and starts a new one. */
    ExperienceBatch takePending() {
        ExperienceBatch taken = pending;
        pending = new ExperienceBatch();
        newExperience = 0;
        return taken;
    }

    void resetNewExperience() {
        newExperience = 0;
    }
}
