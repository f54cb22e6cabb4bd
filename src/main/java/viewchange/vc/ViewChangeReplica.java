package viewchange.vc;

import viewchange.common.Config;
import viewchange.common.Message;
import viewchange.common.MessageId;
import viewchange.common.Replica;
import viewchange.timer.ScheduledCountdownTimer;
import viewchange.vc.messages.ViewChange;
import viewchange.vc.messages.ViewChangeProof;

import java.io.IOException;

/**
 * A roster node running the view-change protocol. Timers and inbound
 * messages all run on the replica's update queue.
 */
public class ViewChangeReplica extends Replica {
    private final ViewChangeStateMachine stateMachine;

    public ViewChangeReplica(Config config) throws IOException {
        this(config, ViewChangeListener.NONE);
    }

    public ViewChangeReplica(Config config, ViewChangeListener listener) throws IOException {
        super(config);
        var progressTimer = new ScheduledCountdownTimer(getName() + "-progress", singularUpdateQueueExecutor, this::onProgressTimeout);
        var proofTimer = new ScheduledCountdownTimer(getName() + "-proof", singularUpdateQueueExecutor, this::onProofTimeout);
        this.stateMachine = new ViewChangeStateMachine(getServerId(), getRoster(), transport(),
                progressTimer, proofTimer, config, listener);
    }

    @Override
    protected void registerHandlers() {
        handlesMessage(MessageId.ViewChange, this::handleViewChange, ViewChange.class);
        handlesMessage(MessageId.ViewChangeProof, this::handleViewChangeProof, ViewChangeProof.class);
    }

    @Override
    protected void onStart() {
        stateMachine.start();
    }

    private void onProgressTimeout() {
        stateMachine.onProgressTimeout();
    }

    private void onProofTimeout() {
        stateMachine.onProofTimeout();
    }

    private void handleViewChange(Message<ViewChange> message) {
        stateMachine.handleViewChange(message.getSenderId(), message.messagePayload());
    }

    private void handleViewChangeProof(Message<ViewChangeProof> message) {
        stateMachine.handleViewChangeProof(message.getSenderId(), message.messagePayload());
    }

    public int getInstalledView() {
        return stateMachine.getInstalledView();
    }

    public int getLeaderId() {
        return stateMachine.leaderId();
    }

    public boolean isLeader() {
        return stateMachine.isLeader();
    }
}
