package viewchange.net;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

//Outbound connection to one peer. Writes already framed messages.
public class SocketClient implements Closeable {
    private static Logger logger = LogManager.getLogger(SocketClient.class.getName());

    private final Socket clientSocket;
    private final DataOutputStream dataStream;

    public SocketClient(InetAddressAndPort address, Duration connectTimeout) throws IOException {
        this.clientSocket = new Socket();
        try {
            clientSocket.setTcpNoDelay(true);
            clientSocket.connect(new InetSocketAddress(address.getAddress(), address.getPort()), (int) connectTimeout.toMillis());
            this.dataStream = new DataOutputStream(clientSocket.getOutputStream());
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    public void sendOneway(byte[] frame) throws IOException {
        dataStream.write(frame);
        dataStream.flush();
    }

    @Override
    public void close() {
        try {
            clientSocket.close();
        } catch (IOException e) {
            logger.debug("Ignoring error while closing " + clientSocket, e);
        }
    }

    public boolean isClosed() {
        return clientSocket.isClosed();
    }
}
