package org.cliffsynth.linalg;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BinaryLltDecompositionTest {

    @Test
    void zeroMatrixNeedsEveryDiagonalCorrection() {
        LltDecomposition llt = BinaryLltDecomposition.decompose(new BitMatrix(3, 3));
        assertThat(llt.factor().isIdentity()).isTrue();
        for (int i = 0; i < 3; i++) {
            assertThat(llt.correctionAt(i)).isTrue();
        }
        assertThat(llt.reconstruct().isZero()).isTrue();
    }

    @Test
    void identityNeedsNoCorrection() {
        LltDecomposition llt = BinaryLltDecomposition.decompose(BitMatrix.identity(3));
        assertThat(llt.factor().isIdentity()).isTrue();
        assertThat(llt.diagonal()).containsOnly(false);
    }

    @Test
    void allOnesTwoByTwo() {
        LltDecomposition llt = BinaryLltDecomposition.decompose(BitMatrix.of("11", "11"));
        assertThat(llt.factor()).isEqualTo(BitMatrix.of("10", "11"));
        assertThat(llt.correctionAt(0)).isFalse();
        assertThat(llt.correctionAt(1)).isTrue();
    }

    @Test
    void zeroDiagonalMatrixReconstructs() {
        BitMatrix d = BitMatrix.of("011", "101", "110");
        assertThat(BinaryLltDecomposition.decompose(d).reconstruct()).isEqualTo(d);
    }

    @Test
    void randomSymmetricMatricesReconstruct() {
        Well19937c rng = new Well19937c(5L);
        for (int n = 1; n <= 8; n++) {
            for (int trial = 0; trial < 20; trial++) {
                BitMatrix d = new BitMatrix(n, n);
                for (int i = 0; i < n; i++) {
                    for (int j = 0; j <= i; j++) {
                        boolean bit = rng.nextBoolean();
                        d.set(i, j, bit);
                        d.set(j, i, bit);
                    }
                }
                LltDecomposition llt = BinaryLltDecomposition.decompose(d);
                assertThat(llt.reconstruct()).isEqualTo(d);
                BitMatrix l = llt.factor();
                for (int i = 0; i < n; i++) {
                    assertThat(l.get(i, i)).isTrue();
                    for (int j = i + 1; j < n; j++) {
                        assertThat(l.get(i, j)).isFalse();
                    }
                }
            }
        }
    }

    @Test
    void diagonalIsCopiedInAndOut() {
        boolean[] corrections = {true, false};
        LltDecomposition llt = new LltDecomposition(BitMatrix.identity(2), corrections);
        corrections[1] = true;
        assertThat(llt.correctionAt(1)).isFalse();

        llt.diagonal()[0] = false;
        assertThat(llt.correctionAt(0)).isTrue();
        assertThat(llt.diagonal()).containsExactly(true, false);
    }

    @Test
    void rejectsNonSymmetric() {
        assertThatThrownBy(() -> BinaryLltDecomposition.decompose(BitMatrix.of("01", "00")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
