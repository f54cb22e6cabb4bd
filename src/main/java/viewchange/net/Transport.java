package viewchange.net;

import viewchange.common.MessagePayload;

/**
 * Outbound half of the message channel. Delivery is best effort: a message
 * that cannot be delivered is lost, and callers only ever observe the
 * messages that do arrive.
 */
public interface Transport {
    /**
     * Sends the message to the roster member with the given index.
     */
    void sendTo(int nodeId, MessagePayload message);

    /**
     * Sends the message to every roster member, this node included.
     */
    void broadcast(MessagePayload message);
}
