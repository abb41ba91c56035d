package dumb.unity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest extends AbstractTest {

    private final Validator validator = new Validator();

    @Test
    void acceptsExactUnity() {
        var verdict = validator.validate(kif("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))"));
        assertTrue(verdict.accepted());
        assertEquals(Expr.Const.ONE, verdict.normalForm());
        assertNull(verdict.reason());
        assertTrue(verdict.iterations() >= 1);
    }

    @Test
    void rejectsOtherNormalForms() {
        var verdict = validator.validate(kif("(+ x 1)"));
        assertFalse(verdict.accepted());
        assertEquals(kif("(+ 1 x)"), verdict.normalForm());
        assertTrue(verdict.reason().startsWith("Normal form is"), verdict.reason());

        assertFalse(validator.validate(kif("2")).accepted());
        assertFalse(validator.validate(kif("(sin x)")).accepted());
    }

    @Test
    void domainViolationsAreRejections() {
        var verdict = validator.validate(kif("(* (^ 0 -1) 0)"));
        assertFalse(verdict.accepted());
        assertNull(verdict.normalForm());
        assertTrue(verdict.reason().startsWith("Domain violation"), verdict.reason());
    }

    @Test
    void exhaustedIterationCapIsARejection() {
        var capped = new Validator(new Simplifier(1));
        var verdict = capped.validate(kif("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))"));
        assertFalse(verdict.accepted());
        assertTrue(verdict.reason().startsWith("No fixed point"), verdict.reason());
    }
}
