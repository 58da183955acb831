// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.KeelDebug.Channel;

/**
 * Writes debug lines for a {@link Channel} when that channel is enabled in {@link KeelDebug}.
 *
 * <p>
 * Messages use {@link String#formatted} placeholders and pass through
 * {@link LogSanitizer} before output, so secret keys and API keys embedded in
 * URLs or payloads are never printed. Output goes to the {@code sh.keel.debug}
 * SLF4J logger, or straight to stdout (keeping ANSI colors) when attached to a terminal.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.keel.debug");

    private DebugLogger() {
    }

    public static void log(final Channel channel, final String message, final Object... args) {
        if (!KeelDebug.isEnabled(channel)) {
            return;
        }
        final String line = LogSanitizer.sanitize(args == null || args.length == 0 ? message : message.formatted(args));
        if (AnsiColors.IS_TTY) {
            System.out.println(line);
        } else {
            LOG.info("{}", line);
        }
    }

    public static void logRpc(final String message, final Object... args) {
        log(Channel.RPC, message, args);
    }

    public static void logTx(final String message, final Object... args) {
        log(Channel.TX, message, args);
    }

    public static void logBundle(final String message, final Object... args) {
        log(Channel.BUNDLE, message, args);
    }
}
