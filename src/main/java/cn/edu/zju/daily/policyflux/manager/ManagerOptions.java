package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.trainer.TrainerTracker;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.Getter;

/** Settings shared by all policy manager variants. Read once, at manager construction. */
@Getter
public class ManagerOptions {

    private Map<String, Integer> updateTrigger = Collections.emptyMap();
    private Map<String, Integer> warmup = Collections.emptyMap();
    private Consumer<List<TrainerTracker>> postUpdate;

    /** Directory to restore policy states from at construction. */
    private Path loadDir;

    private Path checkpointDir;

    /** Save updated policies every this many versions; 0 disables checkpointing. */
    private int checkpointEvery;

    /** Per-round deadline for trainer replies; null waits indefinitely. */
    private Duration roundTimeout;

    public static ManagerOptions defaults() {
        return new ManagerOptions();
    }

    public ManagerOptions updateTrigger(Map<String, Integer> updateTrigger) {
        this.updateTrigger = updateTrigger == null ? Collections.emptyMap() : updateTrigger;
        return this;
    }

    public ManagerOptions warmup(Map<String, Integer> warmup) {
        this.warmup = warmup == null ? Collections.emptyMap() : warmup;
        return this;
    }

    public ManagerOptions postUpdate(Consumer<List<TrainerTracker>> postUpdate) {
        this.postUpdate = postUpdate;
        return this;
    }

    public ManagerOptions loadDir(Path loadDir) {
        this.loadDir = loadDir;
        return this;
    }

    public ManagerOptions checkpoint(Path checkpointDir, int checkpointEvery) {
        if (checkpointEvery < 0) {
            throw new IllegalArgumentException(
                    "checkpointEvery must not be negative, got " + checkpointEvery);
        }
        this.checkpointDir = checkpointDir;
        this.checkpointEvery = checkpointEvery;
        return this;
    }

    public ManagerOptions roundTimeout(Duration roundTimeout) {
        if (roundTimeout != null && (roundTimeout.isNegative() || roundTimeout.isZero())) {
            throw new IllegalArgumentException("roundTimeout must be positive, got " + roundTimeout);
        }
        this.roundTimeout = roundTimeout;
        return this;
    }
}
