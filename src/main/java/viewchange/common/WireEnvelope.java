package viewchange.common;

//What actually travels inside a frame. The body is the encoded payload,
//its type is selected by messageId.
class WireEnvelope {
    private final Integer messageId;
    private final Integer senderId;
    private final byte[] body;

    public WireEnvelope(Integer messageId, Integer senderId, byte[] body) {
        this.messageId = messageId;
        this.senderId = senderId;
        this.body = body;
    }

    public Integer getMessageId() {
        return messageId;
    }

    public Integer getSenderId() {
        return senderId;
    }

    public byte[] getBody() {
        return body;
    }
}
