// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Persisted form of an identity pool.
 *
 * <pre>{@code
 * {"identities": [{"key_material": "<base58 secret>", "balance_sol": 1.0,
 *                  "balance_tokens": 0, "total_trades": 3, "last_used": 1714564800.5}]}
 * }</pre>
 *
 * @param identities one entry per identity, in pool order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PoolState(@JsonProperty("identities") List<Entry> identities) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    PoolState {
        identities = identities == null ? List.of() : List.copyOf(identities);
    }

    /**
     * @param keyMaterial   base58 64-byte secret key
     * @param balanceSol    cached SOL balance as a decimal
     * @param balanceTokens cached raw token balance
     * @param totalTrades   trades made with this identity
     * @param lastUsed      epoch seconds of last use, 0 if never used
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(
        @JsonProperty("key_material") String keyMaterial,
        @JsonProperty("balance_sol") @Nullable BigDecimal balanceSol,
        @JsonProperty("balance_tokens") @Nullable Long balanceTokens,
        @JsonProperty("total_trades") @Nullable Integer totalTrades,
        @JsonProperty("last_used") @Nullable Double lastUsed
    ) {}

    static PoolState read(final Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), PoolState.class);
    }

    void write(final Path path) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), this);
    }
}
