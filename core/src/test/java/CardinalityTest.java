import io.github.flameyossnowy.resources.api.relationship.Cardinality;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CardinalityTest {

    @Test
    void factories_normalise_to_min_and_max() {
        assertEquals(new Cardinality(1, 1), Cardinality.exactly(1));
        assertEquals(new Cardinality(0, 3), Cardinality.range(0, 3));
        assertEquals(new Cardinality(0, Cardinality.N), Cardinality.n());
        assertEquals(new Cardinality(2, Cardinality.N), Cardinality.atLeast(2));
        assertTrue(Cardinality.n().isUnbounded());
        assertEquals("1..n", Cardinality.atLeast(1).toString());
        assertEquals("3", Cardinality.exactly(3).toString());
    }

    @Test
    void n_to_n_is_rejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> Cardinality.range(Cardinality.N, Cardinality.N));
        assertTrue(error.getMessage().startsWith("Cardinality may not be n..n"));
    }

    @Test
    void inverted_bounds_are_rejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> Cardinality.range(3, 1));
        assertEquals("Cardinality min (3) cannot be larger than the max (1)", error.getMessage());
    }

    @Test
    void negative_min_is_rejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> Cardinality.range(-1, 2));
        assertEquals("Cardinality min must be greater than or equal to 0, but was -1", error.getMessage());
    }

    @Test
    void max_below_one_is_rejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> Cardinality.exactly(0));
        assertEquals("Cardinality max must be greater than or equal to 1, but was 0", error.getMessage());
    }
}
