// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide switches for Keel's verbose debug output.
 *
 * <p>
 * Output is split into {@link Channel channels} that can be enabled one at a
 * time. All channels are off until enabled.
 *
 * <pre>{@code
 * KeelDebug.enable(KeelDebug.Channel.RPC);   // provider traffic only
 * KeelDebug.setEnabled(true);                // everything
 * }</pre>
 */
public final class KeelDebug {

    /** A stream of debug output. */
    public enum Channel {
        /** JSON-RPC requests and responses, health probes, provider switches. */
        RPC,
        /** Transaction sends and confirmation polling. */
        TX,
        /** Bundle submissions, tip escalation and outcomes. */
        BUNDLE
    }

    private static final Set<Channel> ENABLED = ConcurrentHashMap.newKeySet();

    private KeelDebug() {
    }

    public static void enable(final Channel channel) {
        ENABLED.add(channel);
    }

    public static void disable(final Channel channel) {
        ENABLED.remove(channel);
    }

    public static boolean isEnabled(final Channel channel) {
        return ENABLED.contains(channel);
    }

    /**
     * @return {@code true} if at least one channel is on
     */
    public static boolean isEnabled() {
        return !ENABLED.isEmpty();
    }

    /**
     * Turns every channel on or off.
     */
    public static void setEnabled(final boolean enabled) {
        if (enabled) {
            ENABLED.addAll(EnumSet.allOf(Channel.class));
        } else {
            ENABLED.clear();
        }
    }
}
