package viewchange.common;

import com.google.common.base.Objects;
import viewchange.net.InetAddressAndPort;

public class RosterEntry {
    private final String name;
    private final InetAddressAndPort address;

    public RosterEntry(String name, InetAddressAndPort address) {
        this.name = name;
        this.address = address;
    }

    public String getName() {
        return name;
    }

    public InetAddressAndPort getAddress() {
        return address;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RosterEntry that = (RosterEntry) o;
        return Objects.equal(name, that.name) && Objects.equal(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, address);
    }

    @Override
    public String toString() {
        return "RosterEntry{" +
                "name='" + name + '\'' +
                ", address=" + address +
                '}';
    }
}
