// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

/**
 * Counters kept by a {@link BundleCoordinator}.
 *
 * @param totalBundles      bundles submitted, landed or not
 * @param successfulBundles bundles that landed
 * @param successRate       {@code successfulBundles / totalBundles}, 0 before the first bundle
 * @param identityCount     identities in the pool
 */
public record BundleStats(long totalBundles, long successfulBundles, double successRate, int identityCount) {
}
