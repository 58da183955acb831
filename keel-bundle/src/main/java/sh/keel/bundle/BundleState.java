// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

/**
 * Lifecycle of one bundle attempt.
 *
 * <pre>
 * BUILDING -&gt; SUBMITTED -&gt; LANDED
 *                        -&gt; FAILED -&gt; BUILDING (retries left, higher tip)
 *                                  -&gt; FINAL_FAILURE
 * </pre>
 */
public enum BundleState {
    BUILDING,
    SUBMITTED,
    LANDED,
    FAILED,
    FINAL_FAILURE;

    public boolean isTerminal() {
        return this == LANDED || this == FINAL_FAILURE;
    }
}
