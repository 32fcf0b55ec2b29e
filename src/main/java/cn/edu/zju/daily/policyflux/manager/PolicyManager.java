package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import java.util.Map;

/**
 * Manages the training of a set of policies. The policy instances may live in the manager itself,
 * in forked trainer processes or on remote trainer nodes; callers cannot tell the difference.
 *
 * <p>{@link #update} must not be called concurrently. {@link #getState} may be called from any
 * thread at any time and sees either the state before or after a round, never a mix.
 */
public interface PolicyManager {

    /**
     * Runs one update round. Experience is accumulated per policy; every policy whose new
     * experience reaches its trigger and whose total experience reaches its warmup is trained.
     * Policies absent from the input are left alone. The version increases by one even when no
     * policy was trained.
     *
     * @param experienceByPolicy one batch per policy that produced experience since the last call
     * @throws IllegalArgumentException if a policy name is not managed here
     * @throws ManagerClosedException if the manager has exited or a previous round failed
     */
    void update(Map<String, ExperienceBatch> experienceByPolicy);

    /** States of the policies updated in the most recent round. */
    default Map<String, PolicyState> getState() {
        return getState(getVersion() - 1);
    }

    /**
     * States of the policies updated after {@code sinceVersion}, at their latest version. Does not
     * communicate with trainers.
     */
    Map<String, PolicyState> getState(int sinceVersion);

    int getVersion();

    /**
     * Stops all trainer units. Calling it twice, or calling {@link #update} afterwards, throws
     * {@link ManagerClosedException}.
     */
    void exit();
}
