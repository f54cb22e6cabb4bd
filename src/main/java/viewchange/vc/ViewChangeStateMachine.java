package viewchange.vc;

import viewchange.common.Config;
import viewchange.common.Logging;
import viewchange.common.Roster;
import viewchange.net.Transport;
import viewchange.timer.CountdownTimer;
import viewchange.vc.messages.ViewChange;
import viewchange.vc.messages.ViewChangeProof;

import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The view-change protocol of one node.
 *
 * A node that hears nothing from the leader of its view before the progress
 * timer fires asks the roster to move to the next view. A view is installed
 * once a quorum of distinct nodes asked for it, or once a valid proof for it
 * arrives. The leader of the installed view keeps broadcasting the proof,
 * which is what holds the other nodes' progress timers off.
 *
 * Not thread safe. Every method must run on the owning node's update queue.
 */
public class ViewChangeStateMachine implements Logging {
    public static final int GENESIS_VIEW = 0;

    private final int selfId;
    private final Roster roster;
    private final Transport transport;
    private final CountdownTimer progressTimer;
    private final CountdownTimer proofTimer;
    private final Config config;
    private final ViewChangeListener listener;

    //read by tests and the driver from other threads.
    private volatile int installedView = GENESIS_VIEW;
    //null while the genesis view is installed.
    private QuorumCertificate installedCertificate;
    private int highestProposedView = GENESIS_VIEW;
    private final TreeMap<Integer, QuorumCertificate> pendingCertificates = new TreeMap<>();

    public ViewChangeStateMachine(int selfId, Roster roster, Transport transport,
                                  CountdownTimer progressTimer, CountdownTimer proofTimer,
                                  Config config, ViewChangeListener listener) {
        checkArgument(roster.contains(selfId), "node %s is not in %s", selfId, roster);
        this.selfId = selfId;
        this.roster = roster;
        this.transport = transport;
        this.progressTimer = progressTimer;
        this.proofTimer = proofTimer;
        this.config = config;
        this.listener = listener;
    }

    public void start() {
        getLogger().info(selfId + " starting in view " + installedView + " led by " + leaderId());
        progressTimer.reset(config.getProgressTimeout());
    }

    public void onProgressTimeout() {
        if (installedView == Integer.MAX_VALUE) {
            getLogger().error(selfId + " cannot propose a view above " + installedView);
            return;
        }
        int nextView = installedView + 1;
        getLogger().info(selfId + " heard nothing from leader " + leaderId() + " of view " + installedView
                + ", proposing view " + nextView);
        propose(nextView);
    }

    private void propose(int view) {
        highestProposedView = Math.max(highestProposedView, view);
        transport.broadcast(new ViewChange(view));
        progressTimer.reset(config.getProgressTimeout());
        recordAttestation(selfId, view);
    }

    public void handleViewChange(int senderId, ViewChange viewChange) {
        int view = viewChange.view;
        if (view <= installedView) {
            getLogger().debug(selfId + " ignoring stale ViewChange for " + view + " from " + senderId
                    + ", installed view is " + installedView);
            return;
        }
        if (!roster.contains(senderId)) {
            getLogger().warn(selfId + " ignoring ViewChange from unknown node " + senderId);
            return;
        }
        if (view > highestProposedView) {
            getLogger().info(selfId + " joining candidacy of " + senderId + " for view " + view);
            propose(view);
            if (view <= installedView) {
                return;
            }
        }
        recordAttestation(senderId, view);
    }

    private void recordAttestation(int senderId, int view) {
        if (view <= installedView) {
            return;
        }
        QuorumCertificate certificate = pendingCertificates
                .getOrDefault(view, QuorumCertificate.empty(view))
                .withAttestation(senderId, view);
        pendingCertificates.put(view, certificate);

        if (certificate.provesView(view, roster)) {
            int leader = roster.leaderFor(view);
            getLogger().info(selfId + " collected quorum " + certificate.supportersOf(view, roster) + " for view " + view);
            listener.onQuorumReached(view, leader);
            install(view, certificate);
        }
    }

    public void handleViewChangeProof(int senderId, ViewChangeProof proof) {
        int view = proof.view;
        if (!proof.certificate.provesView(view, roster)) {
            getLogger().debug(selfId + " discarding proof for view " + view + " from " + senderId
                    + ", supporters " + proof.certificate.supportersOf(view, roster) + " are not a quorum");
            return;
        }
        if (view < installedView) {
            getLogger().debug(selfId + " ignoring proof for old view " + view + " from " + senderId);
            return;
        }
        progressTimer.reset(config.getProgressTimeout());
        if (view > installedView) {
            getLogger().info(selfId + " learned view " + view + " from proof sent by " + senderId);
            install(view, proof.certificate);
        }
    }

    public void onProofTimeout() {
        if (!isLeader() || installedCertificate == null) {
            return;
        }
        broadcastProof();
    }

    private void install(int view, QuorumCertificate certificate) {
        checkArgument(view > installedView, "view %s is not above installed view %s", view, installedView);
        installedView = view;
        installedCertificate = certificate;
        highestProposedView = Math.max(highestProposedView, view);
        pendingCertificates.headMap(view, true).clear();
        progressTimer.reset(config.getProgressTimeout());

        int leader = leaderId();
        getLogger().info(selfId + " installed view " + view + " led by " + leader);
        if (leader == selfId && config.leaderSendsProofs()) {
            broadcastProof();
        } else {
            proofTimer.stop();
        }
        listener.onViewInstalled(view, leader);
    }

    private void broadcastProof() {
        transport.broadcast(new ViewChangeProof(installedView, installedCertificate));
        proofTimer.reset(config.getProofInterval());
    }

    public boolean isLeader() {
        return leaderId() == selfId;
    }

    public int leaderId() {
        return roster.leaderFor(installedView);
    }

    public int getInstalledView() {
        return installedView;
    }

    public QuorumCertificate getInstalledCertificate() {
        return installedCertificate;
    }

    public int getHighestProposedView() {
        return highestProposedView;
    }

    Map<Integer, QuorumCertificate> pendingCertificates() {
        return pendingCertificates;
    }
}
