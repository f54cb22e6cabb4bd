package viewchange.net;


import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

public class InetAddressAndPort implements Comparable<InetAddressAndPort> {
    private final InetAddress address;
    private final Integer port;

    public InetAddressAndPort(InetAddress address, Integer port) {
        this.address = address;
        this.port = port;
    }

    public static InetAddressAndPort create(String hostIp, Integer port) throws UnknownHostException {
        return new InetAddressAndPort(InetAddress.getByName(hostIp), port);
    }

    public InetAddress getAddress() {
        return address;
    }

    public Integer getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InetAddressAndPort that = (InetAddressAndPort) o;
        return Objects.equals(address, that.address) &&
                Objects.equals(port, that.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, port);
    }

    @Override
    public String toString() {
       return "[" +
                   address.getHostAddress() +
               "," +
                   port +
               ']';
    }

    @Override
    public int compareTo(InetAddressAndPort other) {
        int i = this.address.toString().compareTo(other.address.toString());
        return i == 0? Integer.compare(port, other.port) : i;
    }
}
