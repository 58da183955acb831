// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core;

import static sh.keel.core.AnsiColors.*;

/**
 * Log formatter for Keel debug output.
 *
 * <p>
 * Every line uses a bracketed {@code [OPERATION]} tag, a status symbol
 * ({@code ✓ ✗ ○}) where a status applies, shortened base58 identifiers
 * ({@code 5VER...Xk2P}) and human-readable durations.
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("getLatestBlockhash", 1_200));
 * // [RPC] method=getLatestBlockhash duration=1.20ms
 *
 * DebugLogger.logRpc(LogFormatter.formatProviderSwitch("https://a.example", 0.93));
 * // [PROVIDER] switched to https://a.example score=0.93
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int ID_PREFIX_LENGTH = 4;

    private static final int ID_SUFFIX_LENGTH = 4;

    private static final int ID_SHORTEN_THRESHOLD = ID_PREFIX_LENGTH + ID_SUFFIX_LENGTH + 3;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=getBalance duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=sendTransaction code=-32000 message=error duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [HEALTH] endpoint=https://a.example duration=12.00ms
     * or: ✗ [HEALTH] endpoint=https://a.example error=Timeout
     */
    public static String formatHealthCheck(String endpoint, boolean healthy, String error, long durationMicros) {
        if (healthy) {
            return String.format(
                    "%s✓%s %s[HEALTH]%s endpoint=%s %s",
                    TEAL, RESET,
                    TEAL, RESET,
                    endpoint,
                    duration(durationMicros));
        }
        return String.format(
                "%s✗%s %s[HEALTH]%s endpoint=%s error=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                endpoint,
                CORAL, error, RESET);
    }

    /**
     * Format: [PROVIDER] switched to https://a.example score=0.93
     */
    public static String formatProviderSwitch(String endpoint, double score) {
        return String.format(
                "%s[PROVIDER]%s switched to %s score=%.2f",
                AMBER, RESET,
                endpoint,
                score);
    }

    /**
     * Format: [TX-SEND] payer=7xKX...sAsU instructions=3 attempt=1
     */
    public static String formatTxSend(String payer, int instructionCount, int attempt) {
        return String.format(
                "%s[TX-SEND]%s payer=%s instructions=%d attempt=%d",
                LAVENDER, RESET,
                shorten(payer),
                instructionCount,
                attempt);
    }

    /**
     * Format: [TX-SIGNATURE] signature=5VER...Xk2P duration=934μs
     */
    public static String formatTxSignature(String signature, long durationMicros) {
        return String.format(
                "%s[TX-SIGNATURE]%s signature=%s %s",
                LAVENDER, RESET,
                shorten(signature),
                duration(durationMicros));
    }

    /**
     * Format: ○ [TX-WAIT] signature=5VER...Xk2P commitment=confirmed
     */
    public static String formatTxWait(String signature, String commitment) {
        return String.format(
                "%s○%s %s[TX-WAIT]%s signature=%s commitment=%s",
                SLATE, RESET,
                SLATE, RESET,
                shorten(signature),
                commitment);
    }

    /**
     * Format: ✓ [TX-CONFIRM] signature=5VER...Xk2P status=CONFIRMED
     * or: ✗ [TX-CONFIRM] signature=5VER...Xk2P status=FAILED
     */
    public static String formatTxConfirm(String signature, boolean confirmed) {
        String symbol = confirmed ? "✓" : "✗";
        String color = confirmed ? TEAL : CORAL;
        String statusText = confirmed ? "CONFIRMED" : "FAILED";

        return String.format(
                "%s%s%s %s[TX-CONFIRM]%s signature=%s status=%s%s%s",
                color, symbol, RESET,
                color, RESET,
                shorten(signature),
                color, statusText, RESET);
    }

    /**
     * Format: [BUNDLE] attempt=1/3 transactions=5 tip=100000000
     */
    public static String formatBundleSubmit(int attempt, int maxAttempts, int transactionCount, long tip) {
        return String.format(
                "%s[BUNDLE]%s attempt=%d/%d transactions=%d tip=%d",
                AMBER, RESET,
                attempt, maxAttempts,
                transactionCount,
                tip);
    }

    /**
     * Format: ✓ [BUNDLE-RESULT] id=bund...1234 state=LANDED
     */
    public static String formatBundleResult(String bundleId, String state, boolean landed) {
        String symbol = landed ? "✓" : "✗";
        String color = landed ? TEAL : CORAL;
        return String.format(
                "%s%s%s %s[BUNDLE-RESULT]%s id=%s state=%s%s%s",
                color, symbol, RESET,
                color, RESET,
                bundleId != null ? shorten(bundleId) : "none",
                color, state, RESET);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Shortens a base58 identifier to {@code abcd...wxyz}.
     */
    static String shorten(String id) {
        if (id == null || id.length() <= ID_SHORTEN_THRESHOLD) {
            return id;
        }
        return id.substring(0, ID_PREFIX_LENGTH)
                + "..."
                + id.substring(id.length() - ID_SUFFIX_LENGTH);
    }
}
