package cn.edu.zju.daily.policyflux.policy;

import cn.edu.zju.daily.policyflux.experience.ExperienceStore;
import java.util.Collections;
import java.util.Map;

/**
 * A policy whose model can be updated from experience. Only trainable policies can be managed by a
 * policy manager.
 *
 * <p>Implementations are not required to be thread-safe: a trainable policy is only ever driven by
 * the single trainer unit that owns it.
 */
public interface TrainablePolicy extends Policy {

    /**
     * Runs one learning step on the content of the experience store.
     *
     * @return whether the model was actually updated
     */
    boolean learn();

    PolicyState getState();

    void setState(PolicyState state);

    ExperienceStore getExperienceStore();

    /** Diagnostics of the last learning step, reported back through trainer trackers. */
    default Map<String, Object> getTracker() {
        return Collections.emptyMap();
    }
}
