package morriscore.random;

import static org.assertj.core.api.Assertions.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.junit.jupiter.api.Test;

class CommonsRandomSourceTest {

    @Test
    void sameSeedSameStream() {
        CommonsRandomSource a = new CommonsRandomSource(42L);
        CommonsRandomSource b = new CommonsRandomSource(42L);
        for (int i = 0; i < 20; i++) {
            assertThat(a.nextInt(7)).isEqualTo(b.nextInt(7));
            assertThat(a.nextPermutation(5)).containsExactly(b.nextPermutation(5));
            assertThat(a.nextDirections(4)).containsExactly(b.nextDirections(4));
        }
    }

    @Test
    void nextIntStaysInBounds() {
        CommonsRandomSource random = new CommonsRandomSource(1L);
        for (int i = 0; i < 1000; i++) {
            assertThat(random.nextInt(3)).isBetween(0, 2);
        }
    }

    @Test
    void nextIntRejectsNonPositiveBound() {
        CommonsRandomSource random = new CommonsRandomSource(1L);
        assertThatThrownBy(() -> random.nextInt(0)).isInstanceOf(NotStrictlyPositiveException.class);
    }

    @Test
    void permutationContainsEveryIndexOnce() {
        CommonsRandomSource random = new CommonsRandomSource(7L);
        for (int i = 0; i < 50; i++) {
            int[] perm = random.nextPermutation(6);
            int[] sorted = perm.clone();
            Arrays.sort(sorted);
            assertThat(sorted).containsExactly(0, 1, 2, 3, 4, 5);
        }
    }

    @Test
    void permutationsCoverSymmetricGroup() {
        CommonsRandomSource random = new CommonsRandomSource(11L);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            seen.add(Arrays.toString(random.nextPermutation(3)));
        }
        assertThat(seen).hasSize(6);
    }

    @Test
    void emptyDrawsForZeroSize() {
        CommonsRandomSource random = new CommonsRandomSource(3L);
        assertThat(random.nextPermutation(0)).isEmpty();
        assertThat(random.nextDirections(0)).isEmpty();
    }

    @Test
    void negativeSizesRejected() {
        CommonsRandomSource random = new CommonsRandomSource(3L);
        assertThatThrownBy(() -> random.nextPermutation(-1)).isInstanceOf(NotPositiveException.class);
        assertThatThrownBy(() -> random.nextDirections(-1)).isInstanceOf(NotPositiveException.class);
    }

    @Test
    void directionsAreBalancedSigns() {
        CommonsRandomSource random = new CommonsRandomSource(5L);
        int[] dirs = random.nextDirections(10_000);
        int plus = 0;
        for (int v : dirs) {
            assertThat(v).isIn(1, -1);
            if (v == 1) plus++;
        }
        assertThat(plus).isBetween(4_700, 5_300);
    }
}
