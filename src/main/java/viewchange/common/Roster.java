package viewchange.common;

import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * The ordered, fixed set of nodes taking part in a run. The position of a
 * node in the roster is its id, and the leader of view v is the node at
 * position v mod N. Every node must load the same ordering.
 */
public class Roster {
    private final ImmutableList<RosterEntry> entries;

    public Roster(List<RosterEntry> entries) {
        if (entries.isEmpty()) {
            throw new ConfigurationException("Roster must contain at least one node");
        }
        Set<String> names = new HashSet<>();
        for (RosterEntry entry : entries) {
            if (!names.add(entry.getName())) {
                throw new ConfigurationException("Duplicate roster entry " + entry.getName());
            }
        }
        this.entries = ImmutableList.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public RosterEntry get(int nodeId) {
        checkElementIndex(nodeId, entries.size(), "nodeId");
        return entries.get(nodeId);
    }

    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < entries.size();
    }

    public ImmutableList<RosterEntry> entries() {
        return entries;
    }

    public int indexOf(String name) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getName().equals(name)) {
                return i;
            }
        }
        throw new ConfigurationException("Node " + name + " is not in the roster " + names());
    }

    public int leaderFor(int view) {
        checkArgument(view >= 0, "view must be non-negative, was %s", view);
        return view % entries.size();
    }

    public int quorum() {
        return entries.size() / 2 + 1;
    }

    private List<String> names() {
        return entries.stream().map(RosterEntry::getName).collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return "Roster" + names();
    }
}
