package viewchange.common;

/**
 * A payload received from a peer, together with the roster index of the peer
 * that sent it.
 */
public class Message<T> {
    private final T payload;
    final Header header;

    public Message(T payload, Header header) {
        this.header = header;
        this.payload = payload;
    }

    public T messagePayload() {
        return payload;
    }

    public MessageId getMessageId() {
        return header.messageId;
    }

    public int getSenderId() {
        return header.senderId;
    }

    @Override
    public String toString() {
        return "Message{" +
                "payload=" + payload +
                ", senderId=" + header.senderId +
                '}';
    }

    public record Header(int senderId, MessageId messageId){};
}
