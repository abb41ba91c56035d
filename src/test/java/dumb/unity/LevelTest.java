package dumb.unity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LevelTest {

    @ParameterizedTest
    @CsvSource({"1, ELEMENTARY", "2, MIDDLE", "3, HIGH", "elementary, ELEMENTARY", "Middle, MIDDLE", "HIGH, HIGH", "' 3 ', HIGH"})
    void parsesSelectors(String selector, Level expected) {
        assertEquals(expected, Level.parse(selector));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"4", "0", "expert", "-1"})
    void unknownSelectorsDefaultToElementary(String selector) {
        assertEquals(Level.ELEMENTARY, Level.parse(selector));
    }

    @Test
    void budgetsGrowWithLevel() {
        assertTrue(Level.ELEMENTARY.maxDepth < Level.MIDDLE.maxDepth && Level.MIDDLE.maxDepth < Level.HIGH.maxDepth);
        assertTrue(Level.ELEMENTARY.minNodes < Level.HIGH.minNodes);
        assertEquals(Level.HIGH.maxDepth + Domain.GUARD_DEPTH, Level.HIGH.maxBaseDepth());
        assertEquals(Level.MIDDLE, Level.of(2));
        assertTrue(Level.HIGH.nests());
        assertFalse(Level.MIDDLE.nests());
    }

    @Test
    void onlyHigherLevelsUseCalculus() {
        assertFalse(Level.ELEMENTARY.weights.containsKey(Generator.Kind.DERIVATIVE));
        assertFalse(Level.MIDDLE.weights.containsKey(Generator.Kind.SIN));
        assertTrue(Level.HIGH.weights.containsKey(Generator.Kind.INTEGRAL));
        assertTrue(Level.MIDDLE.weights.containsKey(Generator.Kind.SQRT));
    }
}
