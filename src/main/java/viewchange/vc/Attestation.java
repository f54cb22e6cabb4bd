package viewchange.vc;

import com.google.common.base.Objects;

/**
 * Node {@code senderId} asked to move to {@code view}.
 */
public class Attestation {
    private final int senderId;
    private final int view;

    public Attestation(int senderId, int view) {
        this.senderId = senderId;
        this.view = view;
    }

    public int getSenderId() {
        return senderId;
    }

    public int getView() {
        return view;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attestation that = (Attestation) o;
        return senderId == that.senderId && view == that.view;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(senderId, view);
    }

    @Override
    public String toString() {
        return "(" + senderId + "," + view + ")";
    }
}
