package cn.edu.zju.daily.policyflux.manager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable record of which policies each update round touched. Entry 0 holds every policy, so
 * that a consumer at version -1 receives the full state.
 *
 * <p>Each history links to the one it was appended to, so appending is constant time and older
 * histories stay valid for readers still holding them.
 */
public final class VersionHistory {

    private final VersionHistory previous;
    private final Set<String> updated;
    private final int version;

    private VersionHistory(VersionHistory previous, Set<String> updated, int version) {
        this.previous = previous;
        this.updated = updated;
        this.version = version;
    }

    public static VersionHistory initial(Collection<String> policyNames) {
        return new VersionHistory(
                null, Collections.unmodifiableSet(new LinkedHashSet<>(policyNames)), 0);
    }

    public int version() {
        return version;
    }

    /** Returns a new history with one more round; the empty set is a legal round. */
    public VersionHistory append(Set<String> updated) {
        return new VersionHistory(
                this, Collections.unmodifiableSet(new LinkedHashSet<>(updated)), version + 1);
    }

    /** @throws IndexOutOfBoundsException if the version is not in this history */
    public Set<String> round(int version) {
        if (version < 0 || version > this.version) {
            throw new IndexOutOfBoundsException(
                    "Version " + version + " is not in 0.." + this.version);
        }
        VersionHistory node = this;
        while (node.version > version) {
            node = node.previous;
        }
        return node.updated;
    }

    /**
     * Policies touched in rounds {@code sinceVersion + 1} up to the current version, in the order
     * they were first touched. Versions below -1 are treated as -1, versions at or above the
     * current one yield an empty set. Costs one step per round after {@code sinceVersion}.
     */
    public Set<String> updatedSince(int sinceVersion) {
        List<Set<String>> rounds = new ArrayList<>();
        VersionHistory node = this;
        while (node != null && node.version > sinceVersion) {
            rounds.add(node.updated);
            node = node.previous;
        }
        Set<String> result = new LinkedHashSet<>();
        for (int i = rounds.size() - 1; i >= 0; i--) {
            result.addAll(rounds.get(i));
        }
        return result;
    }
}
