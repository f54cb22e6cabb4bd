package viewchange.common;

import org.junit.Test;
import viewchange.net.InetAddressAndPort;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RosterTest {

    @Test
    public void leaderRotatesThroughRoster() {
        Roster roster = TestUtils.unstartedRoster(5);

        assertEquals(0, roster.leaderFor(0));
        assertEquals(3, roster.leaderFor(3));
        assertEquals(0, roster.leaderFor(5));
        assertEquals(2, roster.leaderFor(12));
    }

    @Test
    public void quorumIsStrictMajority() {
        assertEquals(1, TestUtils.unstartedRoster(1).quorum());
        assertEquals(2, TestUtils.unstartedRoster(3).quorum());
        assertEquals(3, TestUtils.unstartedRoster(4).quorum());
        assertEquals(3, TestUtils.unstartedRoster(5).quorum());
    }

    @Test
    public void findsNodeByName() {
        Roster roster = TestUtils.unstartedRoster(3);

        assertEquals(2, roster.indexOf("node2"));
        assertTrue(roster.contains(2));
        assertFalse(roster.contains(3));
        assertFalse(roster.contains(-1));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownNameIsConfigurationError() {
        TestUtils.unstartedRoster(3).indexOf("athens");
    }

    @Test(expected = ConfigurationException.class)
    public void rejectsEmptyRoster() {
        new Roster(Collections.emptyList());
    }

    @Test(expected = ConfigurationException.class)
    public void rejectsDuplicateNames() {
        var address = new InetAddressAndPort(InetAddress.getLoopbackAddress(), 42069);
        new Roster(Arrays.asList(new RosterEntry("athens", address), new RosterEntry("athens", address)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeViewHasNoLeader() {
        TestUtils.unstartedRoster(3).leaderFor(-1);
    }
}
