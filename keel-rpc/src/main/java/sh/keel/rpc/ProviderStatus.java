// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

/**
 * Health classification of an RPC provider, derived from its consecutive
 * failure count.
 */
public enum ProviderStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    /** No observation recorded yet. */
    UNKNOWN;

    /**
     * Returns whether a provider in this status may be preferred during selection.
     */
    public boolean isUsable() {
        return this == HEALTHY || this == DEGRADED;
    }
}
