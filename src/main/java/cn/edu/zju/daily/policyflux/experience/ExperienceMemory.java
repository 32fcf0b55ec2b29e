package cn.edu.zju.daily.policyflux.experience;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Bounded FIFO experience store. When full, the oldest transitions are overwritten. */
public class ExperienceMemory implements ExperienceStore {

    private final int capacity;
    private final Deque<Transition> transitions;
    private long overwritten = 0;

    public ExperienceMemory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.transitions = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public synchronized void put(ExperienceBatch batch) {
        for (Transition transition : batch.getTransitions()) {
            if (transitions.size() == capacity) {
                transitions.pollFirst();
                overwritten++;
            }
            transitions.addLast(transition);
        }
    }

    @Override
    public synchronized int size() {
        return transitions.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /** Number of transitions dropped so far because the memory was full. */
    public synchronized long getOverwritten() {
        return overwritten;
    }

    /** Returns a copy of the stored transitions, oldest first. */
    public synchronized List<Transition> getAll() {
        return new ArrayList<>(transitions);
    }

    public synchronized void clear() {
        transitions.clear();
    }
}
