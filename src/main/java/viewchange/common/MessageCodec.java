package viewchange.common;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps typed protocol messages to length prefixed frames and back.
 *
 * A frame is a four byte big-endian length followed by a CBOR encoded
 * {@link WireEnvelope}. The envelope carries the message type, the roster
 * index of the sender and the CBOR encoded payload.
 *
 * Decoding never lets a runtime exception escape. Anything that does not
 * decode into a registered, well-formed payload is reported as
 * {@link MalformedMessageException}.
 */
public class MessageCodec {
    public static final int LENGTH_PREFIX_SIZE = 4;
    public static final int MAX_FRAME_SIZE = 1024 * 1024;

    private final Map<MessageId, Class<? extends MessagePayload>> payloadClasses = new ConcurrentHashMap<>();

    public MessageCodec register(MessageId messageId, Class<? extends MessagePayload> payloadClass) {
        payloadClasses.put(messageId, payloadClass);
        return this;
    }

    public byte[] encode(MessagePayload payload, int senderId) {
        var envelope = new WireEnvelope(payload.getMessageId().getId(), senderId, JsonSerDes.serialize(payload));
        byte[] envelopeBytes = JsonSerDes.serialize(envelope);
        ByteBuffer frame = ByteBuffer.allocate(LENGTH_PREFIX_SIZE + envelopeBytes.length);
        frame.putInt(envelopeBytes.length);
        frame.put(envelopeBytes);
        return frame.array();
    }

    public Message<MessagePayload> decode(byte[] frame) throws MalformedMessageException {
        if (frame == null || frame.length < LENGTH_PREFIX_SIZE) {
            throw new MalformedMessageException("Truncated frame, no length prefix");
        }
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        int length = buffer.getInt();
        checkFrameLength(length);
        if (buffer.remaining() != length) {
            throw new MalformedMessageException("Frame announces " + length + " bytes but carries " + buffer.remaining());
        }
        byte[] envelopeBytes = new byte[length];
        buffer.get(envelopeBytes);
        return decodeBody(envelopeBytes);
    }

    public static void checkFrameLength(int length) throws MalformedMessageException {
        if (length <= 0 || length > MAX_FRAME_SIZE) {
            throw new MalformedMessageException("Invalid frame length " + length);
        }
    }

    //Decodes a frame whose length prefix has already been consumed by the reader.
    public Message<MessagePayload> decodeBody(byte[] envelopeBytes) throws MalformedMessageException {
        WireEnvelope envelope = deserialize(envelopeBytes, WireEnvelope.class);
        if (envelope == null || envelope.getMessageId() == null
                || envelope.getSenderId() == null || envelope.getBody() == null) {
            throw new MalformedMessageException("Incomplete envelope");
        }
        if (envelope.getSenderId() < 0) {
            throw new MalformedMessageException("Invalid sender id " + envelope.getSenderId());
        }
        MessageId messageId = MessageId.valueOf(envelope.getMessageId());
        if (messageId == null) {
            throw new MalformedMessageException("Unknown message type " + envelope.getMessageId());
        }
        Class<? extends MessagePayload> payloadClass = payloadClasses.get(messageId);
        if (payloadClass == null) {
            throw new MalformedMessageException("No payload registered for " + messageId);
        }
        MessagePayload payload = deserialize(envelope.getBody(), payloadClass);
        if (payload == null || payload.getMessageId() != messageId) {
            throw new MalformedMessageException("Payload does not match message type " + messageId);
        }
        if (!payload.isWellFormed()) {
            throw new MalformedMessageException("Invalid " + messageId + " payload " + payload);
        }
        return new Message<>(payload, new Message.Header(envelope.getSenderId(), messageId));
    }

    private static <T> T deserialize(byte[] bytes, Class<T> clazz) throws MalformedMessageException {
        try {
            return JsonSerDes.deserialize(bytes, clazz);
        } catch (RuntimeException e) {
            throw new MalformedMessageException("Unable to decode " + clazz.getSimpleName(), e);
        }
    }
}
