// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class LamportsTest {

    @Test
    void convertsSolToLamportsRoundingDown() {
        assertEquals(100_000_000L, Lamports.fromSol("0.1").value());
        assertEquals(10_000_000L, Lamports.fromSol("0.01").value());
        assertEquals(1L, Lamports.fromSol("0.0000000019").value());
    }

    @Test
    void convertsLamportsToSol() {
        assertEquals(new BigDecimal("1.500000000"), Lamports.of(1_500_000_000L).toSol());
    }

    @Test
    void arithmetic() {
        Lamports a = Lamports.of(700);
        Lamports b = Lamports.of(300);
        assertEquals(Lamports.of(1000), a.plus(b));
        assertEquals(Lamports.of(400), a.minusOrZero(b));
        assertEquals(Lamports.ZERO, b.minusOrZero(a));
        assertTrue(b.isLessThan(a));
        assertTrue(a.compareTo(b) > 0);
    }

    @Test
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Lamports.of(-1));
        assertThrows(IllegalArgumentException.class, () -> Lamports.fromSol("-0.5"));
    }
}
