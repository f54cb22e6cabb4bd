package viewchange.vc;

import com.google.common.base.Objects;
import viewchange.common.Roster;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Evidence that a majority of the roster wants to move to a view. Immutable;
 * {@link #withAttestation} returns a new certificate.
 *
 * A certificate proves view v once it holds attestations for a view of at
 * least v from a quorum of distinct roster members. Several attestations
 * from the same member count once.
 */
public class QuorumCertificate {
    private final int view;
    private final Set<Attestation> attestations;

    public QuorumCertificate(int view, Set<Attestation> attestations) {
        this.view = view;
        this.attestations = Collections.unmodifiableSet(new LinkedHashSet<>(checkNotNull(attestations, "attestations")));
    }

    public static QuorumCertificate empty(int view) {
        return new QuorumCertificate(view, Collections.emptySet());
    }

    public QuorumCertificate withAttestation(int senderId, int attestedView) {
        Set<Attestation> extended = new LinkedHashSet<>(attestations);
        extended.add(new Attestation(senderId, attestedView));
        return new QuorumCertificate(view, extended);
    }

    public int getView() {
        return view;
    }

    public Set<Attestation> getAttestations() {
        return attestations;
    }

    public Set<Integer> supportersOf(int candidateView, Roster roster) {
        Set<Integer> supporters = new TreeSet<>();
        for (Attestation attestation : attestations) {
            if (attestation.getView() >= candidateView && roster.contains(attestation.getSenderId())) {
                supporters.add(attestation.getSenderId());
            }
        }
        return supporters;
    }

    public boolean provesView(int candidateView, Roster roster) {
        return supportersOf(candidateView, roster).size() >= roster.quorum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuorumCertificate that = (QuorumCertificate) o;
        return view == that.view && Objects.equal(attestations, that.attestations);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(view, attestations);
    }

    @Override
    public String toString() {
        return "QuorumCertificate{" +
                "view=" + view +
                ", attestations=" + attestations +
                '}';
    }
}
