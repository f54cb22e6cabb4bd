package viewchange.common;

import org.junit.Before;
import org.junit.Test;
import viewchange.vc.QuorumCertificate;
import viewchange.vc.messages.ViewChange;
import viewchange.vc.messages.ViewChangeProof;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class MessageCodecTest {
    private MessageCodec codec;

    @Before
    public void setUp() {
        codec = new MessageCodec()
                .register(MessageId.ViewChange, ViewChange.class)
                .register(MessageId.ViewChangeProof, ViewChangeProof.class);
    }

    @Test
    public void decodesViewChangeWithSender() throws MalformedMessageException {
        Message<MessagePayload> message = codec.decode(codec.encode(new ViewChange(7), 2));

        assertEquals(MessageId.ViewChange, message.getMessageId());
        assertEquals(2, message.getSenderId());
        assertEquals(new ViewChange(7), message.messagePayload());
    }

    @Test
    public void decodesProofWithItsCertificate() throws MalformedMessageException {
        QuorumCertificate certificate = QuorumCertificate.empty(3)
                .withAttestation(0, 3)
                .withAttestation(1, 3)
                .withAttestation(4, 5);

        Message<MessagePayload> message = codec.decode(codec.encode(new ViewChangeProof(3, certificate), 3));

        ViewChangeProof proof = (ViewChangeProof) message.messagePayload();
        assertEquals(3, proof.view);
        assertEquals(certificate, proof.certificate);
    }

    @Test
    public void framesStartWithBodyLength() {
        byte[] frame = codec.encode(new ViewChange(1), 0);

        assertEquals(frame.length - MessageCodec.LENGTH_PREFIX_SIZE, ByteBuffer.wrap(frame).getInt());
    }

    @Test
    public void rejectsTruncatedFrame() {
        byte[] frame = codec.encode(new ViewChange(1), 0);

        assertMalformed(Arrays.copyOf(frame, frame.length - 1));
        assertMalformed(Arrays.copyOf(frame, 2));
        assertMalformed(new byte[0]);
    }

    @Test
    public void rejectsNegativeAndOversizedLengths() {
        assertMalformed(ByteBuffer.allocate(8).putInt(-4).putInt(0).array());
        assertMalformed(ByteBuffer.allocate(8).putInt(MessageCodec.MAX_FRAME_SIZE + 1).putInt(0).array());
    }

    @Test
    public void rejectsGarbage() {
        byte[] garbage = "not a message".getBytes();
        assertMalformed(ByteBuffer.allocate(4 + garbage.length).putInt(garbage.length).put(garbage).array());
    }

    @Test
    public void rejectsUnknownMessageType() {
        assertMalformed(frameOf(new WireEnvelope(99, 0, JsonSerDes.serialize(new ViewChange(1)))));
    }

    @Test
    public void rejectsBodyThatDoesNotMatchItsType() {
        assertMalformed(frameOf(new WireEnvelope(MessageId.ViewChangeProof.getId(), 0, JsonSerDes.serialize(new ViewChange(1)))));
    }

    @Test
    public void rejectsNegativeSender() {
        assertMalformed(frameOf(new WireEnvelope(MessageId.ViewChange.getId(), -1, JsonSerDes.serialize(new ViewChange(1)))));
    }

    @Test
    public void rejectsNegativeView() {
        assertMalformed(codec.encode(new ViewChange(-1), 0));
    }

    @Test
    public void rejectsProofWhoseCertificateIsForAnotherView() {
        QuorumCertificate certificate = QuorumCertificate.empty(2).withAttestation(0, 2);
        assertMalformed(codec.encode(new ViewChangeProof(3, certificate), 0));
    }

    @Test
    public void rejectsTypeWithoutRegisteredPayload() {
        MessageCodec viewChangeOnly = new MessageCodec().register(MessageId.ViewChange, ViewChange.class);
        byte[] frame = codec.encode(new ViewChangeProof(1, QuorumCertificate.empty(1)), 0);
        try {
            viewChangeOnly.decode(frame);
            fail("expected MalformedMessageException");
        } catch (MalformedMessageException expected) {
        }
    }

    private byte[] frameOf(WireEnvelope envelope) {
        byte[] body = JsonSerDes.serialize(envelope);
        return ByteBuffer.allocate(4 + body.length).putInt(body.length).put(body).array();
    }

    private void assertMalformed(byte[] frame) {
        try {
            codec.decode(frame);
            fail("expected MalformedMessageException");
        } catch (MalformedMessageException expected) {
        }
    }
}
