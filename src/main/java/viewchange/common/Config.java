package viewchange.common;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

public class Config {
    private final String nodeName;
    private final Roster roster;
    private final int serverId;
    private Duration progressTimeout = Duration.ofSeconds(3);
    private Duration proofInterval = Duration.ofSeconds(1);
    private Duration connectTimeout = Duration.ofMillis(500);
    private boolean leaderSendsProofs = true;

    public Config(String nodeName, Roster roster) {
        this.nodeName = nodeName;
        this.roster = roster;
        this.serverId = roster.indexOf(nodeName);
    }

    public Config withProgressTimeout(Duration progressTimeout) {
        checkArgument(!progressTimeout.isNegative() && !progressTimeout.isZero(), "progress timeout must be positive");
        this.progressTimeout = progressTimeout;
        return this;
    }

    public Config withProofInterval(Duration proofInterval) {
        checkArgument(!proofInterval.isNegative() && !proofInterval.isZero(), "proof interval must be positive");
        this.proofInterval = proofInterval;
        return this;
    }

    public Config withConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    //Leaders keep quiet, so every progress timeout moves the run to the next view.
    public Config withoutLeaderProofs() {
        this.leaderSendsProofs = false;
        return this;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Roster getRoster() {
        return roster;
    }

    public int getServerId() {
        return serverId;
    }

    public Duration getProgressTimeout() {
        return progressTimeout;
    }

    public Duration getProofInterval() {
        return proofInterval;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public boolean leaderSendsProofs() {
        return leaderSendsProofs;
    }
}
