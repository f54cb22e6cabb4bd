package viewchange.common;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import viewchange.net.NIOSocketListener;
import viewchange.net.SocketTransport;
import viewchange.net.Transport;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/*
    A Replica is one node of the roster. Replicas communicate only by message passing.
    Inbound messages are decoded on the listener thread and then handed to
    the singular update queue, which also runs the timers. All protocol
    state is therefore touched by one thread only and needs no locking.
*/

public abstract class Replica {
    private static Logger logger = LogManager.getLogger(Replica.class);
    private final Config config;
    private final NIOSocketListener peerListener;
    private final SocketTransport socketTransport;
    protected final MessageCodec codec = new MessageCodec();

    //SingleThreaded executor used to execute all the state manipulation methods of replica, so that
    //all the state updates happen in a single thread, without needing any synchronization.
    protected final ScheduledExecutorService singularUpdateQueueExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r);
        thread.setDaemon(true);
        return thread;
    });

    final Map<MessageId, MessageHandler> handlers = new ConcurrentHashMap<>();

    public Replica(Config config) throws IOException {
        this.config = config;
        this.socketTransport = new SocketTransport(config.getRoster(), config.getServerId(), codec, config.getConnectTimeout());
        this.registerHandlers();
        this.peerListener = new NIOSocketListener(this::handlePeerMessage, codec, config.getRoster().get(config.getServerId()).getAddress());
    }

    public final void start() {
        peerListener.start();
        runOnEventLoop(this::onStart);
    }

    //subclasses can execute logic at startup, on the update queue.
    // e.g. starting timers
    protected void onStart() {

    }

    protected abstract void registerHandlers();

    static class MessageHandler<Req extends MessagePayload> {
        Class<Req> requestClass;
        Consumer<Message<Req>> handler;

        public MessageHandler(Class<Req> requestClass, Consumer<Message<Req>> handler) {
            this.requestClass = requestClass;
            this.handler = handler;
        }
    }

    protected <Req extends MessagePayload> void handlesMessage(MessageId messageId, Consumer<Message<Req>> handler, Class<Req> requestClass) {
        codec.register(messageId, requestClass);
        handlers.put(messageId, new MessageHandler(requestClass, handler));
    }

    //handles messages sent by peers in the roster.
    void handlePeerMessage(Message<MessagePayload> message) {
        var messageHandler = handlers.get(message.getMessageId());
        if (messageHandler == null) {
            logger.warn(getName() + " has no handler for " + message.getMessageId());
            return;
        }
        runOnEventLoop(() -> messageHandler.handler.accept(message));
    }

    protected void runOnEventLoop(Runnable action) {
        try {
            singularUpdateQueueExecutor.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    logger.error(getName() + " failed to process event", e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug(getName() + " is shut down, dropping event");
        }
    }

    protected Transport transport() {
        return socketTransport;
    }

    public void dropMessagesTo(Replica n) {
        socketTransport.dropMessagesTo(n.getRosterEntry().getAddress());
    }

    public void dropAfterNMessagesTo(Replica n, int dropAfterNoOfMessages) {
        socketTransport.dropMessagesAfter(n.getRosterEntry().getAddress(), dropAfterNoOfMessages);
    }

    public void reconnectTo(Replica n) {
        socketTransport.reconnectTo(n.getRosterEntry().getAddress());
    }

    public Config getConfig() {
        return config;
    }

    public Roster getRoster() {
        return config.getRoster();
    }

    public int getServerId() {
        return config.getServerId();
    }

    public String getName() {
        return config.getNodeName();
    }

    public RosterEntry getRosterEntry() {
        return getRoster().get(getServerId());
    }

    public int quorum() {
        return getRoster().quorum();
    }

    public void shutdown() {
        logger.info(getName() + " shutting down");
        peerListener.shutdown();
        singularUpdateQueueExecutor.shutdownNow();
        socketTransport.close();
    }
}
