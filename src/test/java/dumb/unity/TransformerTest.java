package dumb.unity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Random;

import static dumb.unity.Identity.*;
import static org.junit.jupiter.api.Assertions.*;

class TransformerTest extends AbstractTest {

    private final Generator generator = new Generator();

    @Test
    void schemesPerLevel() {
        assertEquals(EnumSet.of(MULTIPLICATIVE_INVERSE, SHIFTED_INVERSE), Transformer.schemes(Level.ELEMENTARY).keySet());
        assertEquals(EnumSet.of(MULTIPLICATIVE_INVERSE, SHIFTED_INVERSE, EXPONENTIAL_CANCELLATION, ROOT_POWER),
                Transformer.schemes(Level.MIDDLE).keySet());
        assertEquals(EnumSet.allOf(Identity.class), Transformer.schemes(Level.HIGH).keySet());
    }

    @ParameterizedTest
    @EnumSource(Level.class)
    void compositesStayWithinDepthBudget(Level level) {
        var transformer = new Transformer();
        for (var seed = 0; seed < 100; seed++) {
            var random = seeded(seed);
            var composite = transformer.compose(generator.generate(level, random), level, random);
            assertTrue(composite.expr().depth() <= level.maxCompositeDepth, () -> composite.expr().toKif());
            assertTrue(Transformer.schemes(level).keySet().containsAll(composite.schemes()));
            if (!level.nests()) assertEquals(1, composite.schemes().size());
        }
    }

    @Test
    void nestingWrapsUntilTheDepthBudget() {
        var always = new Transformer(X, 1.0);
        var never = new Transformer(X, 0.0);
        var base = kif("(+ (^ x 2) 1)");
        var nested = always.compose(base, Level.HIGH, new Random(1));
        assertTrue(nested.schemes().size() > 1);
        assertTrue(nested.expr().depth() <= Level.HIGH.maxCompositeDepth);
        assertUnity(nested.expr());
        assertEquals(1, never.compose(base, Level.HIGH, new Random(1)).schemes().size());
    }

    @Test
    void chooseCanBeOverridden() {
        var pythagorean = new Transformer() {
            @Override
            protected Identity choose(Level level, Random random) {
                return PYTHAGOREAN;
            }
        };
        var composite = pythagorean.compose(kif("(+ x 2)"), Level.ELEMENTARY, new Random(0));
        assertEquals(PYTHAGOREAN, composite.outermost());
        assertEquals(kif("(+ (^ (sin (+ x 2)) 2) (^ (cos (+ x 2)) 2))"), composite.expr());
    }

    @Test
    void rejectsBadNestProbability() {
        assertThrows(IllegalArgumentException.class, () -> new Transformer(X, 1.5));
    }
}
