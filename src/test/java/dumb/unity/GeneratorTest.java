package dumb.unity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorTest extends AbstractTest {

    private final Generator generator = new Generator();

    @ParameterizedTest
    @EnumSource(Level.class)
    void baseExpressionsRespectTheLevelBudget(Level level) {
        for (var seed = 0; seed < 300; seed++) {
            var base = generator.generate(level, seeded(seed));
            assertTrue(base.depth() <= level.maxBaseDepth(), () -> "Too deep: " + base.toKif());
            assertTrue(base.weight() >= level.minNodes, () -> "Too small: " + base.toKif());
            assertTrue(base.containsVar(X), () -> "No variable: " + base.toKif());
            assertTrue(Domain.nonZero(base), () -> "Not guarded: " + base.toKif());
        }
    }

    @ParameterizedTest
    @EnumSource(Level.class)
    void rawTreesStayWithinDepth(Level level) {
        var random = seeded(11);
        for (var i = 0; i < 300; i++) {
            var raw = generator.grow(level, level.maxDepth, true, random);
            assertTrue(raw.depth() <= level.maxDepth, () -> "Too deep: " + raw.toKif());
        }
    }

    @Test
    void elementaryUsesOnlyArithmetic() {
        for (var seed = 0; seed < 200; seed++) {
            var base = generator.generate(Level.ELEMENTARY, seeded(seed));
            assertFalse(base.toKif().matches(".*\\((sin|cos|exp|log|sqrt|abs|d|int|lim) .*"), base.toKif());
        }
    }

    @Test
    void sameSeedSameExpression() {
        assertEquals(generator.generate(Level.HIGH, seeded(42)), generator.generate(Level.HIGH, seeded(42)));
    }

    @Test
    void seedsGiveVariety() {
        var seen = new HashSet<String>();
        for (var seed = 0; seed < 50; seed++)
            seen.add(Canon.fingerprint(generator.generate(Level.MIDDLE, seeded(seed))));
        assertTrue(seen.size() > 40, "Only " + seen.size() + " distinct bases");
    }

    @Test
    void constantsAreNonZeroAndSmall() {
        var random = new Random(3);
        for (var i = 0; i < 500; i++) {
            var c = Generator.constant(random).intValueExact();
            assertTrue(c != 0 && Math.abs(c) <= Generator.MAX_CONSTANT, "constant " + c);
        }
    }

    @Test
    void polynomialsAreExpanded() {
        var p = generator.polynomial(3, seeded(5));
        assertTrue(Domain.polynomial(p, X));
        assertEquals(4, ((Expr.Nary) p).size());
        assertTrue(p.depth() <= 4);
    }
}
