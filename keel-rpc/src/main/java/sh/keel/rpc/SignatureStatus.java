// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * One entry of a {@code getSignatureStatuses} response.
 *
 * @param slot               the slot the transaction was processed in
 * @param confirmations      confirmations so far, {@code null} once rooted
 * @param confirmationStatus {@code processed}, {@code confirmed} or {@code finalized}
 * @param err                the on-chain error, {@code null} when the transaction succeeded
 */
public record SignatureStatus(
        long slot,
        @Nullable Long confirmations,
        @Nullable String confirmationStatus,
        @Nullable Object err) {

    public boolean failed() {
        return err != null;
    }

    static SignatureStatus fromRpc(final Map<?, ?> value) {
        final Object slot = value.get("slot");
        final Object confirmations = value.get("confirmations");
        final Object status = value.get("confirmationStatus");
        return new SignatureStatus(
                slot instanceof Number n ? n.longValue() : 0L,
                confirmations instanceof Number n ? n.longValue() : null,
                status != null ? status.toString() : null,
                value.get("err"));
    }
}
