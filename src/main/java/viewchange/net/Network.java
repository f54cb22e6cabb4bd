package viewchange.net;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Sends frames to peers. Every peer address gets its own lane: a single
 * thread with a cached connection, so frames to one peer stay in order and
 * an unreachable peer only holds up its own lane.
 *
 * A lane whose backlog is full drops its oldest frame. Failed writes close the
 * cached connection, which is re-opened by the next frame.
 *
 * Tests can make a peer unreachable with {@link #dropMessagesTo} and
 * {@link #dropMessagesAfter}.
 */
class Network {
    private static Logger logger = LogManager.getLogger(Network.class);

    static final int MAX_PENDING_FRAMES_PER_PEER = 1024;

    private final Duration connectTimeout;
    private final Map<InetAddressAndPort, Lane> lanes = new ConcurrentHashMap<>();

    final Set<InetAddressAndPort> dropRequestsTo = ConcurrentHashMap.newKeySet();
    final Map<InetAddressAndPort, Integer> noOfMessages = new ConcurrentHashMap<>();
    final Map<InetAddressAndPort, Integer> dropAfter = new ConcurrentHashMap<>();

    Network(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public void sendOneWay(InetAddressAndPort address, byte[] frame) throws IOException {
        if (dropRequestsTo.contains(address) || noOfMessagesReachedLimit(address)) {
            throw new IOException("Unable to connect to " + address);
        }
        noOfMessages.merge(address, 1, Integer::sum);
        laneFor(address).send(frame);
    }

    private Lane laneFor(InetAddressAndPort address) {
        return lanes.computeIfAbsent(address, Lane::new);
    }

    private boolean noOfMessagesReachedLimit(InetAddressAndPort address) {
        Integer dropAfterMessages = dropAfter.get(address);
        Integer noOfMessages = this.noOfMessages.get(address);
        return dropAfterMessages == null?false:(noOfMessages != null && noOfMessages >= dropAfterMessages);
    }

    public void dropMessagesTo(InetAddressAndPort address) {
        dropRequestsTo.add(address);
    }

    public void reconnectTo(InetAddressAndPort address) {
        dropRequestsTo.remove(address);
        dropAfter.remove(address);
        noOfMessages.remove(address); //also reset message counter to specific address.
    }

    public void dropMessagesAfter(InetAddressAndPort address, int dropAfterNoOfMessages) {
        noOfMessages.remove(address); //only count messages here after.
        dropAfter.put(address, dropAfterNoOfMessages);
    }

    public void closeAllConnections() {
        for (Lane lane : lanes.values()) {
            lane.shutdown();
        }
        lanes.clear();
    }

    private class Lane {
        private final InetAddressAndPort address;
        private final ThreadPoolExecutor executor;
        private SocketClient client;

        Lane(InetAddressAndPort address) {
            this.address = address;
            this.executor = new ThreadPoolExecutor(1, 1, 0, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(MAX_PENDING_FRAMES_PER_PEER),
                    new ThreadFactoryBuilder().setDaemon(true).setNameFormat("lane-" + address + "-%d").build(),
                    new ThreadPoolExecutor.DiscardOldestPolicy());
        }

        void send(byte[] frame) {
            executor.execute(() -> write(frame));
        }

        private void write(byte[] frame) {
            try {
                if (client == null || client.isClosed()) {
                    client = new SocketClient(address, connectTimeout);
                }
                client.sendOneway(frame);
            } catch (IOException e) {
                logger.error("Communication failure sending message to " + address + ": " + e.getMessage());
                closeClient();
            }
        }

        private void closeClient() {
            if (client != null) {
                client.close();
                client = null;
            }
        }

        void shutdown() {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Lane to " + address + " did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            closeClient();
        }
    }
}
