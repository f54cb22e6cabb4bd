package viewchange.net;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import viewchange.common.MalformedMessageException;
import viewchange.common.Message;
import viewchange.common.MessageCodec;
import viewchange.common.MessagePayload;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;

//One inbound connection. Frames are read without blocking the selector.
class NIOConnection {
    private static final Logger LOG = LogManager.getLogger(NIOConnection.class);

    private SocketChannel sock;
    private final SelectionKey sk;
    private final NIOSocketListener server;
    private final InboundMessageConsumer consumer;
    private final MessageCodec codec;
    private boolean closed;
    private BoundedByteBufferReceive receive = null;

    NIOConnection(SocketChannel sock, SelectionKey sk, NIOSocketListener server, InboundMessageConsumer consumer, MessageCodec codec) {
        this.sock = sock;
        this.sk = sk;
        this.server = server;
        this.consumer = consumer;
        this.codec = codec;
    }

    void doIO(SelectionKey selectionKey) {
        try {
            if (sock == null) {
                return;
            }
            if (selectionKey.isReadable()) {
                read();
            }
        } catch (MalformedMessageException e) {
            LOG.warn("Discarding malformed message from " + remoteAddress() + ": " + e.getMessage());
            close();
        } catch (EOFException | CancelledKeyException e) {
            close();
        } catch (IOException e) {
            LOG.warn("Connection from " + remoteAddress() + " lost: " + e.getMessage());
            close();
        }
    }

    private void read() throws IOException, MalformedMessageException {
        if (receive == null) {
            receive = new BoundedByteBufferReceive();
        }
        receive.readFrom(sock);
        if (receive.complete) {
            Message<MessagePayload> message = codec.decodeBody(receive.content());
            receive = null; //ready to read next message.
            consumer.accept(message);
        } else {
            // more reading to be done
            LOG.trace("Did not finish reading, registering for read again on connection " + remoteAddress());
        }
    }

    private String remoteAddress() {
        try {
            return sock == null ? "closed connection" : String.valueOf(sock.getRemoteAddress());
        } catch (IOException e) {
            return "unknown address";
        }
    }

    void close() {
        if (closed) {
            return;
        }
        closed = true;
        server.removeCnxn(this);
        try {
            sock.close();
        } catch (IOException e) {
            LOG.warn("ignoring exception during socketchannel close", e);
        }
        sock = null;
        if (sk != null) {
            try {
                // need to cancel this selection key from the selector
                sk.cancel();
            } catch (Exception e) {
                LOG.warn("ignoring exception during selectionkey cancel", e);
            }
        }
    }
}
