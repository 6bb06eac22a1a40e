package com.questrail.bhumi.relay.model;

import com.questrail.bhumi.relay.api.Commit;
import com.questrail.bhumi.relay.api.Id52;
import com.questrail.bhumi.relay.api.Preimage;

import java.util.List;
import java.util.Objects;

/**
 * Client → relay identity claim.
 *
 * <p>Carries the claimed identity, the proof of possession of its private key,
 * the full set of admission commits the identity currently accepts, and the
 * responses it recently produced so a new relay can answer retries.</p>
 */
public record IAm(Id52 id52, byte[] signature, List<Commit> commits, List<RecentResponse> recentResponses)
        implements RelayMessage
{
    public static final int SIGNATURE_LENGTH = 64;

    public IAm {
        Objects.requireNonNull(id52, "id52");
        Objects.requireNonNull(signature, "signature");
        if (signature.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        commits = List.copyOf(commits);
        recentResponses = List.copyOf(recentResponses);
    }

    @Override
    public RelayMessageType type() {
        return RelayMessageType.I_AM;
    }

    /**
     * A response the identity produced earlier, keyed by the preimage the sender
     * used.
     */
    public record RecentResponse(Preimage preimage, byte[] response) {
        public RecentResponse {
            Objects.requireNonNull(preimage, "preimage");
            Objects.requireNonNull(response, "response");
        }
    }
}
