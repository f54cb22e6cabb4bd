package viewchange.common;

public class MessagePayload {
    public final MessageId messageId;

    public MessagePayload(MessageId messageId) {
        this.messageId = messageId;
    }

    public MessageId getMessageId() {
        return messageId;
    }

    //Checked by the codec after decoding. Payloads received from the wire
    //are rejected as malformed when this returns false.
    public boolean isWellFormed() {
        return true;
    }
}
