// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one bundle submission to a {@link BundleRelay}.
 *
 * @param success      whether the relay accepted the bundle
 * @param bundleId     relay-assigned identifier when accepted
 * @param errorMessage reason for rejection
 */
public record RelaySubmission(boolean success, @Nullable String bundleId, @Nullable String errorMessage) {

    public static RelaySubmission accepted(final String bundleId) {
        return new RelaySubmission(true, bundleId, null);
    }

    public static RelaySubmission rejected(final String errorMessage) {
        return new RelaySubmission(false, null, errorMessage);
    }
}
