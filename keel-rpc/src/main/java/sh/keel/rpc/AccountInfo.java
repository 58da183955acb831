// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.keel.core.error.RpcException;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;

/**
 * An on-chain account as returned by {@code getAccountInfo} with base64 encoding.
 *
 * @param lamports   the account balance
 * @param owner      the program that owns the account
 * @param data       the decoded account data
 * @param executable whether the account holds a program
 * @param rentEpoch  the next rent epoch
 */
public record AccountInfo(Lamports lamports, PublicKey owner, byte[] data, boolean executable, long rentEpoch) {

    public AccountInfo {
        Objects.requireNonNull(lamports, "lamports");
        Objects.requireNonNull(owner, "owner");
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    static AccountInfo fromRpc(final Map<?, ?> value) {
        try {
            final Object rawData = value.get("data");
            final byte[] bytes;
            if (rawData instanceof List<?> parts && !parts.isEmpty()) {
                bytes = Base64.getDecoder().decode(parts.get(0).toString());
            } else if (rawData instanceof String s) {
                bytes = Base64.getDecoder().decode(s);
            } else {
                bytes = new byte[0];
            }
            final Object rentEpoch = value.get("rentEpoch");
            return new AccountInfo(
                    Lamports.of(((Number) value.get("lamports")).longValue()),
                    new PublicKey(value.get("owner").toString()),
                    bytes,
                    Boolean.TRUE.equals(value.get("executable")),
                    rentEpoch instanceof Number n ? n.longValue() : 0L);
        } catch (RuntimeException e) {
            throw new RpcException(RpcException.PARSE_ERROR, "Malformed account info: " + value, null, e);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountInfo other)) {
            return false;
        }
        return executable == other.executable
                && rentEpoch == other.rentEpoch
                && lamports.equals(other.lamports)
                && owner.equals(other.owner)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lamports, owner, Arrays.hashCode(data), executable, rentEpoch);
    }

    @Override
    public String toString() {
        return "AccountInfo{lamports=" + lamports.value() + ", owner=" + owner
                + ", dataLength=" + data.length + ", executable=" + executable + "}";
    }
}
