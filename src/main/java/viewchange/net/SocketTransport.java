package viewchange.net;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import viewchange.common.MessageCodec;
import viewchange.common.MessagePayload;
import viewchange.common.Roster;
import viewchange.common.RosterEntry;

import java.io.IOException;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link Transport} over TCP. Broadcast is a unicast loop over the whole roster,
 * this node included, so a node receives its own broadcasts through the same
 * path as everybody else's.
 */
public class SocketTransport implements Transport {
    private static final Logger logger = LogManager.getLogger(SocketTransport.class);

    private final Roster roster;
    private final int selfId;
    private final MessageCodec codec;
    private final Network network;

    public SocketTransport(Roster roster, int selfId, MessageCodec codec, Duration connectTimeout) {
        this.roster = roster;
        this.selfId = selfId;
        this.codec = codec;
        this.network = new Network(connectTimeout);
    }

    @Override
    public void sendTo(int nodeId, MessagePayload message) {
        checkArgument(roster.contains(nodeId), "node %s is not in %s", nodeId, roster);
        logger.debug(selfName() + " sending " + message.getMessageId() + " to " + roster.get(nodeId).getName());
        send(roster.get(nodeId), codec.encode(message, selfId));
    }

    @Override
    public void broadcast(MessagePayload message) {
        logger.debug(selfName() + " broadcasting " + message);
        byte[] frame = codec.encode(message, selfId);
        for (RosterEntry entry : roster.entries()) {
            send(entry, frame);
        }
    }

    private void send(RosterEntry entry, byte[] frame) {
        try {
            network.sendOneWay(entry.getAddress(), frame);
        } catch (IOException e) {
            logger.error("Communication failure sending message to " + entry.getName() + " from " + selfName());
        }
    }

    private String selfName() {
        return roster.get(selfId).getName();
    }

    public void dropMessagesTo(InetAddressAndPort address) {
        network.dropMessagesTo(address);
    }

    public void dropMessagesAfter(InetAddressAndPort address, int noOfMessages) {
        network.dropMessagesAfter(address, noOfMessages);
    }

    public void reconnectTo(InetAddressAndPort address) {
        network.reconnectTo(address);
    }

    public void close() {
        network.closeAllConnections();
    }
}
