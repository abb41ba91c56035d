package dumb.unity;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static dumb.unity.Expr.*;
import static org.junit.jupiter.api.Assertions.*;

class ExprTest extends AbstractTest {

    @Test
    void constantsAreNormalized() {
        assertEquals(Const.HALF, num(2, 4));
        var c = num(1, -2);
        assertEquals(BigInteger.ONE.negate(), c.num());
        assertEquals(BigInteger.TWO, c.den());
        assertEquals("-1/2", c.toKif());
        assertThrows(IllegalArgumentException.class, () -> num(1, 0));
    }

    @Test
    void constantArithmetic() {
        assertEquals(num(5, 6), num(1, 2).plus(num(1, 3)));
        assertEquals(num(-3, 4), num(3, 2).times(num(-1, 2)));
        assertEquals(num(8, 27), num(2, 3).pow(3));
        assertEquals(num(9, 4), num(2, 3).pow(-2));
        assertEquals(num(2, 3), num(4, 9).root(2));
        assertNull(num(2).root(2));
        assertThrows(DomainGuardViolation.class, Const.ZERO::reciprocal);
    }

    @Test
    void weightAndDepth() {
        var e = kif("(+ x (* 2 x))");
        assertEquals(5, e.weight());
        assertEquals(3, e.depth());
        assertEquals(1, X.depth());
        assertEquals(4, kif("(sin (^ x 2))").depth());
    }

    @Test
    void variablesAreInternedAndValidated() {
        assertSame(Var.of("y"), Var.of("y"));
        assertThrows(IllegalArgumentException.class, () -> Var.of("1y"));
    }

    @Test
    void replaceSubstitutesFreeOccurrences() {
        assertEquals(kif("(+ (^ 2 2) 1)"), kif("(+ (^ x 2) 1)").replace(X, num(2)));
        var bound = kif("(lim (+ x 1) x 0)");
        assertEquals(bound, bound.replace(X, num(3)));
        assertThrows(IllegalArgumentException.class, () -> kif("(+ y (d (^ x 2) x 1))").replace(X, num(1)));
    }

    @Test
    void definiteIntegralBindsItsVariable() {
        assertFalse(kif("(int x x 0 1)").containsVar(X));
        assertTrue(kif("(int x x)").containsVar(X));
        assertTrue(kif("(int x x 0 x)").containsVar(X));
        assertThrows(IllegalArgumentException.class, () -> new Integral(X, X, num(0), null));
    }

    @Test
    void malformedNodesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Derivative(X, X, 0));
        assertThrows(IllegalArgumentException.class, () -> new Fn(Fn.Func.SIN, List.of(X, X)));
    }

    @Test
    void kifAndInfixText() {
        var e = kif("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))");
        assertEquals("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))", e.toKif());
        assertEquals("(x^2 + 1)*(x^2 + 1)^(-1)", e.toString());
        assertEquals("x^2 - 3*x", kif("(+ (^ x 2) (* -3 x))").toString());
        assertEquals("limit(sin(x), x -> 0)", kif("(lim (sin x) x 0)").toString());
    }

    @Test
    void jsonTree() {
        var json = kif("(+ x 1)").toJson();
        assertEquals("add", json.getString("type"));
        assertEquals(2, json.getJSONArray("operands").length());
        assertEquals("var", json.getJSONArray("operands").getJSONObject(0).getString("type"));
    }
}
