package dumb.unity;

import dumb.unity.ExprParser.ParseException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    protected static final Expr.Var X = Level.X;

    protected static Expr kif(String text) {
        try {
            return ExprParser.parse(text);
        } catch (ParseException e) {
            return fail("Parse failed for '" + text + "': " + e.getMessage());
        }
    }

    /** Normal form of {@code text}, which must reach a fixed point. */
    protected static Expr simplified(String text) {
        return simplified(kif(text));
    }

    protected static Expr simplified(Expr e) {
        var result = new Simplifier().simplify(e);
        assertTrue(result.fixedPoint(), () -> "No fixed point for " + e.toKif() + ", stopped at " + result.normalForm().toKif());
        return result.normalForm();
    }

    protected static void assertSimplifiesTo(String expected, String text) {
        assertEquals(kif(expected), simplified(text), () -> "Simplifying " + text);
    }

    protected static void assertUnity(Expr e) {
        var verdict = new Validator().validate(e);
        assertTrue(verdict.accepted(), () -> "Expected 1 from " + e.toKif() + ": " + verdict.reason());
    }

    protected static void assertUnity(String text) {
        assertUnity(kif(text));
    }

    protected static Random seeded(long seed) {
        return new Random(seed);
    }
}
