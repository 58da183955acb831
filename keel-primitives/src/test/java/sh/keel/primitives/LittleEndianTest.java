// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LittleEndianTest {

    @Test
    void writesU32LowByteFirst() {
        byte[] out = new byte[5];
        LittleEndian.putU32(out, 1, 85_000L);
        assertArrayEquals(new byte[] {0, 0x08, 0x4C, 0x01, 0x00}, out);
    }

    @Test
    void u64RoundTripsAtOffset() {
        byte[] out = new byte[72];
        LittleEndian.putU64(out, 64, 1_234_567_890_123L);
        assertEquals(1_234_567_890_123L, LittleEndian.getU64(out, 64));
    }

    @Test
    void rejectsInvalidRanges() {
        assertThrows(IllegalArgumentException.class, () -> LittleEndian.putU32(new byte[4], 0, 0x1_0000_0000L));
        assertThrows(IllegalArgumentException.class, () -> LittleEndian.putU64(new byte[8], 0, -1L));
        assertThrows(IllegalArgumentException.class, () -> LittleEndian.getU64(new byte[7], 0));
    }
}
