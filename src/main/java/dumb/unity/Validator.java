package dumb.unity;

import org.jetbrains.annotations.Nullable;

/**
 * Accepts an expression only when bounded rewriting reaches the constant 1 at a fixed point.
 * Anything else, including a rewrite that meets an undefined operation, is a rejection.
 */
public class Validator {

    private final Simplifier simplifier;

    public Validator() {
        this(new Simplifier());
    }

    public Validator(Simplifier simplifier) {
        this.simplifier = simplifier;
    }

    public Verdict validate(Expr e) {
        Simplifier.Result result;
        try {
            result = simplifier.simplify(e);
        } catch (DomainGuardViolation v) {
            return Verdict.reject(null, 0, "Domain violation: " + v.getMessage());
        }
        if (!result.fixedPoint())
            return Verdict.reject(result.normalForm(), result.iterations(),
                    "No fixed point within " + simplifier.iterationCap() + " iterations");
        if (!result.normalForm().is(Expr.Const.ONE))
            return Verdict.reject(result.normalForm(), result.iterations(),
                    "Normal form is " + result.normalForm().toKif());
        return new Verdict(true, result.normalForm(), result.iterations(), null);
    }

    public record Verdict(boolean accepted, @Nullable Expr normalForm, int iterations, @Nullable String reason) {
        static Verdict reject(@Nullable Expr normalForm, int iterations, String reason) {
            return new Verdict(false, normalForm, iterations, reason);
        }
    }
}
