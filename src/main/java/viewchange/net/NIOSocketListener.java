package viewchange.net;

import viewchange.common.Logging;
import viewchange.common.MessageCodec;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.*;

/**
 * Inbound half of the message channel. Accepts connections from every peer
 * (this node included) on the node's roster port and hands each decoded
 * message to the consumer, on the listener thread.
 */
public class NIOSocketListener extends Thread implements Logging {
    private final ServerSocketChannel ss;
    private final Selector selector;
    private final InboundMessageConsumer consumer;
    private final MessageCodec codec;

    public NIOSocketListener(InboundMessageConsumer consumer, MessageCodec codec, InetAddressAndPort listenAddress) throws IOException {
        super("listener-" + listenAddress);
        this.consumer = consumer;
        this.codec = codec;
        this.selector = Selector.open();
        this.ss = ServerSocketChannel.open();
        ss.socket().setReuseAddress(true);
        //peers may know this node by any of its addresses, so listen on all of them.
        ss.socket().bind(new InetSocketAddress(listenAddress.getPort()));
        ss.configureBlocking(false);
        ss.register(selector, SelectionKey.OP_ACCEPT);
        setDaemon(true);
    }

    final Set<NIOConnection> cnxns = new HashSet<>();

    @Override
    public void run() {
        while (!ss.socket().isClosed()) {
            try {
                selector.select(1000);
                Set<SelectionKey> selected;
                synchronized (this) {
                    selected = selector.selectedKeys();
                }
                ArrayList<SelectionKey> selectedList = new ArrayList<SelectionKey>(
                        selected);
                Collections.shuffle(selectedList);
                for (SelectionKey k : selectedList) {
                    if ((k.readyOps() & SelectionKey.OP_ACCEPT) != 0) {
                        SocketChannel sc = ((ServerSocketChannel) k
                                .channel()).accept();
                        if (sc == null) {
                            continue;
                        }
                        sc.configureBlocking(false);
                        SelectionKey sk = sc.register(selector,
                                SelectionKey.OP_READ);
                        NIOConnection cnxn = new NIOConnection(sc, sk, this, consumer, codec);
                        sk.attach(cnxn);
                        addCnxn(cnxn);
                    } else if ((k.readyOps() & SelectionKey.OP_READ) != 0) {
                        NIOConnection c = (NIOConnection) k.attachment();
                        c.doIO(k);
                    }
                }
                selected.clear();
            } catch (Exception e) {
                if (!ss.socket().isClosed()) {
                    getLogger().error("Unexpected error in listener loop", e);
                }
            }
        }
    }

    private void addCnxn(NIOConnection cnxn) {
        synchronized (cnxns) {
            this.cnxns.add(cnxn);
        }
    }

    void removeCnxn(NIOConnection cnxn) {
        synchronized (cnxns) {
            this.cnxns.remove(cnxn);
        }
    }

    public void shutdown() {
         try {
            ss.close();
            clear();
            this.interrupt();
            this.join();
            selector.close();
        } catch (InterruptedException e) {
            getLogger().warn("Interrupted", e);
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            getLogger().error("Unexpected exception", e);
        }
    }

    synchronized public void clear() {
        selector.wakeup();
        List<NIOConnection> open;
        synchronized (cnxns) {
            open = new ArrayList<>(cnxns);
            cnxns.clear();
        }
        // got to clear all the connections that we have in the selector
        for (NIOConnection cnxn : open) {
            cnxn.close();
        }
    }
}
