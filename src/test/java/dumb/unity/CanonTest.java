package dumb.unity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CanonTest extends AbstractTest {

    @Test
    void operandOrderDoesNotMatter() {
        var a = kif("(+ (* 2 x) (sin x) 1)");
        var b = kif("(+ 1 (sin x) (* x 2))");
        assertTrue(Canon.same(a, b));
        assertEquals(Canon.fingerprint(a), Canon.fingerprint(b));
    }

    @Test
    void nestingAndConstantsAreNormalized() {
        assertEquals(kif("(+ 3 x y)"), Canon.canonical(kif("(+ (+ 1 x) (+ 2 y))")));
        assertEquals(kif("x"), Canon.canonical(kif("(* 1 x)")));
        assertEquals(kif("(* 6 x)"), Canon.canonical(kif("(* 2 (* x 3))")));
        assertEquals(kif("0"), Canon.canonical(kif("(+ 1 -1)")));
    }

    @Test
    void identitiesAreNotApplied() {
        var composite = kif("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))");
        assertFalse(Canon.same(composite, kif("1")));
        assertFalse(Canon.same(kif("(+ x x)"), kif("(* 2 x)")));
    }

    @Test
    void distinctTreesHaveDistinctFingerprints() {
        var a = Canon.fingerprint(kif("(sin (^ x 2))"));
        var b = Canon.fingerprint(kif("(cos (^ x 2))"));
        assertNotEquals(a, b);
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]+"));
    }

    @Test
    void canonicalizationIsIdempotent() {
        var e = Canon.canonical(kif("(* (+ y x) (+ (* 3 x) (^ x 2)) (exp (+ x 1)))"));
        assertEquals(e, Canon.canonical(e));
    }
}
