package cn.edu.zju.daily.policyflux.experience;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered sequence of transitions destined for a single policy. Batches are accumulated by the
 * policy manager and handed over to a trainer once the policy is due for an update.
 */
public class ExperienceBatch implements Serializable {

    private final List<Transition> transitions;

    public ExperienceBatch() {
        this.transitions = new ArrayList<>();
    }

    public ExperienceBatch(List<Transition> transitions) {
        this.transitions = new ArrayList<>(transitions);
    }

    public static ExperienceBatch of(Transition... transitions) {
        ExperienceBatch batch = new ExperienceBatch();
        Collections.addAll(batch.transitions, transitions);
        return batch;
    }

    public int size() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }

    public void add(Transition transition) {
        transitions.add(transition);
    }

    /** Appends all transitions of {@code other}, preserving their order. */
    public void extend(ExperienceBatch other) {
        transitions.addAll(other.transitions);
    }

    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    @Override
    public String toString() {
        return "ExperienceBatch{size=" + transitions.size() + "}";
    }
}
