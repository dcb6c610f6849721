package org.cliffsynth.linalg;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BitMatrixTest {

    @Test
    void parsesAndPrintsRows() {
        BitMatrix m = BitMatrix.of("101", "010");
        assertThat(m.rows()).isEqualTo(2);
        assertThat(m.columns()).isEqualTo(3);
        assertThat(m.get(0, 2)).isTrue();
        assertThat(m.get(1, 0)).isFalse();
        assertThat(m).hasToString("[101, 010]");
    }

    @Test
    void multipliesOverGf2() {
        BitMatrix a = BitMatrix.of("11", "01");
        assertThat(a.times(a)).isEqualTo(BitMatrix.identity(2));
        assertThat(a.plus(a).isZero()).isTrue();
        assertThat(a.transpose()).isEqualTo(BitMatrix.of("10", "11"));
    }

    @Test
    void xorColumnIntoTouchesOnlyTarget() {
        BitMatrix m = BitMatrix.of("10", "11");
        m.xorColumnInto(0, 1);
        assertThat(m).isEqualTo(BitMatrix.of("11", "10"));
    }

    @Test
    void rankAndInvertibility() {
        assertThat(BitMatrix.of("11", "11").rank()).isEqualTo(1);
        assertThat(BitMatrix.of("11", "11").isInvertible()).isFalse();
        assertThat(BitMatrix.of("011", "101", "110").rank()).isEqualTo(2);
        assertThat(BitMatrix.of("01", "10").isInvertible()).isTrue();
        assertThat(new BitMatrix(0, 0).isInvertible()).isTrue();
    }

    @Test
    void augmentPlacesColumnsSideBySide() {
        BitMatrix joined = BitMatrix.of("10", "01").augment(BitMatrix.of("1", "1"));
        assertThat(joined).isEqualTo(BitMatrix.of("101", "011"));
        assertThat(BitMatrix.of("10", "10").augment(BitMatrix.of("0", "1")).rank()).isEqualTo(2);
        assertThatThrownBy(() -> BitMatrix.identity(2).augment(BitMatrix.identity(3)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void symmetryCheck() {
        assertThat(BitMatrix.of("01", "10").isSymmetric()).isTrue();
        assertThat(BitMatrix.of("01", "00").isSymmetric()).isFalse();
    }

    @Test
    void copyIsIndependent() {
        BitMatrix m = BitMatrix.identity(2);
        BitMatrix copy = m.copy();
        copy.flip(0, 1);
        assertThat(m.isIdentity()).isTrue();
        assertThat(copy.isIdentity()).isFalse();
    }

    @Test
    void columnAccessReturnsCopies() {
        BitMatrix m = BitMatrix.of("10", "11");
        boolean[] column = m.column(0);
        column[0] = false;
        assertThat(m.get(0, 0)).isTrue();
        m.setColumn(1, new boolean[]{true, false});
        assertThat(m).isEqualTo(BitMatrix.of("11", "10"));
    }

    @Test
    void rejectsOutOfRangeAccess() {
        BitMatrix m = new BitMatrix(2, 2);
        assertThatThrownBy(() -> m.get(2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> m.set(0, -1, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BitMatrix.of("12")).isInstanceOf(IllegalArgumentException.class);
    }
}
