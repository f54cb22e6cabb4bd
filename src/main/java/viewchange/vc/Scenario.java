package viewchange.vc;

import com.google.common.collect.ImmutableSet;
import viewchange.common.Config;
import viewchange.common.ConfigurationException;

import java.util.Set;

/**
 * Scripted runs selected with {@code --test}. A scenario can crash a node
 * when it collects a quorum for a view it would lead, and stops the node once
 * the run has reached its target.
 */
public enum Scenario {
    NORMAL_CASE(1, ImmutableSet.of(), 1),
    //leaders stay silent so every node gets to lead once, finishing back at node 0.
    FULL_ROTATION(2, ImmutableSet.of(), -1),
    SINGLE_CRASH(3, ImmutableSet.of(1), 2),
    TWO_CRASHES(4, ImmutableSet.of(1, 2), 3),
    THREE_CRASHES(5, ImmutableSet.of(1, 2, 3), 4);

    private final int number;
    private final Set<Integer> crashingNodes;
    private final int targetView;

    Scenario(int number, Set<Integer> crashingNodes, int targetView) {
        this.number = number;
        this.crashingNodes = crashingNodes;
        this.targetView = targetView;
    }

    public static Scenario fromNumber(int number) {
        for (Scenario scenario : values()) {
            if (scenario.number == number) {
                return scenario;
            }
        }
        throw new ConfigurationException("Unknown test case " + number + ", expected 1 to " + values().length);
    }

    public int getNumber() {
        return number;
    }

    public boolean crashesOnQuorum(int nodeId) {
        return crashingNodes.contains(nodeId);
    }

    public boolean isComplete(int view, int leaderId) {
        if (this == FULL_ROTATION) {
            return view > 0 && leaderId == 0;
        }
        return view >= targetView;
    }

    public Config configure(Config config) {
        if (this == FULL_ROTATION) {
            return config.withoutLeaderProofs();
        }
        return config;
    }
}
