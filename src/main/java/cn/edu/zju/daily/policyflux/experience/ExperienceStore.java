package cn.edu.zju.daily.policyflux.experience;

/** Where a trainable policy keeps the experience it learns from. */
public interface ExperienceStore {

    void put(ExperienceBatch batch);

    /** Number of transitions currently held. */
    int size();
}
