package viewchange.vc.messages;

import com.google.common.base.Objects;
import viewchange.common.MessageId;
import viewchange.common.MessagePayload;
import viewchange.vc.Attestation;
import viewchange.vc.QuorumCertificate;

public class ViewChangeProof extends MessagePayload {
    public final int view;
    public final QuorumCertificate certificate;

    public ViewChangeProof(int view, QuorumCertificate certificate) {
        super(MessageId.ViewChangeProof);
        this.view = view;
        this.certificate = certificate;
    }

    @Override
    public boolean isWellFormed() {
        if (view < 0 || certificate == null || certificate.getView() != view) {
            return false;
        }
        for (Attestation attestation : certificate.getAttestations()) {
            if (attestation == null || attestation.getSenderId() < 0 || attestation.getView() < 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViewChangeProof that = (ViewChangeProof) o;
        return view == that.view && Objects.equal(certificate, that.certificate);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(messageId, view, certificate);
    }

    @Override
    public String toString() {
        return "ViewChangeProof{" +
                "view=" + view +
                ", certificate=" + certificate +
                '}';
    }
}
