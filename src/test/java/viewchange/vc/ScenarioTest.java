package viewchange.vc;

import org.junit.Test;
import viewchange.common.Config;
import viewchange.common.ConfigurationException;
import viewchange.common.TestUtils;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ScenarioTest {

    @Test
    public void selectsScenarioByNumber() {
        assertEquals(Scenario.NORMAL_CASE, Scenario.fromNumber(1));
        assertEquals(Scenario.FULL_ROTATION, Scenario.fromNumber(2));
        assertEquals(Scenario.THREE_CRASHES, Scenario.fromNumber(5));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownScenarioIsConfigurationError() {
        Scenario.fromNumber(6);
    }

    @Test
    public void crashingNodesGrowWithScenario() {
        assertFalse(Scenario.NORMAL_CASE.crashesOnQuorum(1));
        assertTrue(Scenario.SINGLE_CRASH.crashesOnQuorum(1));
        assertFalse(Scenario.SINGLE_CRASH.crashesOnQuorum(2));
        assertTrue(Scenario.TWO_CRASHES.crashesOnQuorum(2));
        assertTrue(Scenario.THREE_CRASHES.crashesOnQuorum(3));
        assertFalse(Scenario.THREE_CRASHES.crashesOnQuorum(0));
    }

    @Test
    public void fullRotationCompletesBackAtFirstNode() {
        assertFalse(Scenario.FULL_ROTATION.isComplete(0, 0));
        assertFalse(Scenario.FULL_ROTATION.isComplete(3, 3));
        assertTrue(Scenario.FULL_ROTATION.isComplete(5, 0));
        assertTrue(Scenario.TWO_CRASHES.isComplete(3, 3));
        assertFalse(Scenario.TWO_CRASHES.isComplete(2, 2));
    }

    @Test
    public void fullRotationSilencesLeaders() {
        Config config = new Config("node0", TestUtils.unstartedRoster(5));

        assertFalse(Scenario.FULL_ROTATION.configure(config).leaderSendsProofs());
        assertTrue(Scenario.NORMAL_CASE.configure(new Config("node0", TestUtils.unstartedRoster(5))).leaderSendsProofs());
    }

    @Test
    public void hooksAnnounceLeaderAndExitWhenComplete() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<Integer> exits = new ArrayList<>();
        ScenarioHooks hooks = new ScenarioHooks(Scenario.NORMAL_CASE, 3, new PrintStream(out, true), exits::add);

        hooks.onViewInstalled(1, 1);

        assertEquals("3: Server 1 is the new leader of view 1", out.toString(StandardCharsets.UTF_8).trim());
        assertEquals(List.of(ScenarioHooks.EXIT_COMPLETED), exits);
    }

    @Test
    public void hooksCrashOnlyWhenNodeWouldLead() {
        List<Integer> exits = new ArrayList<>();
        ScenarioHooks hooks = new ScenarioHooks(Scenario.SINGLE_CRASH, 1, new PrintStream(new ByteArrayOutputStream()), exits::add);

        hooks.onQuorumReached(2, 2);
        hooks.onQuorumReached(3, 3);
        assertTrue(exits.isEmpty());

        hooks.onQuorumReached(1, 1);
        assertEquals(List.of(ScenarioHooks.EXIT_CRASHED), exits);
    }

    @Test
    public void singleCrashRunEndsInViewTwo() {
        Map<Integer, Integer> exitCodes = new HashMap<>();
        SimulatedCluster[] holder = new SimulatedCluster[1];
        PrintStream quiet = new PrintStream(new ByteArrayOutputStream());
        SimulatedCluster cluster = new SimulatedCluster(5, Scenario.SINGLE_CRASH::configure,
                id -> new ScenarioHooks(Scenario.SINGLE_CRASH, id, quiet, status -> {
                    exitCodes.putIfAbsent(id, status);
                    holder[0].crash(id);
                }));
        holder[0] = cluster;
        cluster.start();

        cluster.advance(Duration.ofSeconds(10));

        assertEquals(Integer.valueOf(ScenarioHooks.EXIT_CRASHED), exitCodes.get(1));
        for (int id : new int[]{0, 2, 3, 4}) {
            assertEquals(Integer.valueOf(ScenarioHooks.EXIT_COMPLETED), exitCodes.get(id));
            assertEquals(2, cluster.node(id).getInstalledView());
        }
    }
}
