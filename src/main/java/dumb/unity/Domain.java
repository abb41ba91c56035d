package dumb.unity;

import static dumb.unity.Expr.*;

/**
 * Conservative sign analysis and the construction-time guards built on it. A guarded
 * subtree is replaced by {@code g^2 + 1}, which is positive wherever {@code g} is defined.
 */
public enum Domain {
    ;

    /** Levels a single guard adds on top of the guarded subtree. */
    public static final int GUARD_DEPTH = 2;

    /** True only when {@code e} is provably positive wherever it is defined. */
    public static boolean positive(Expr e) {
        if (e instanceof Const c) return c.signum() > 0;
        if (e instanceof Nary n) {
            if (n.kind == Nary.Kind.ADD)
                return n.operands.stream().allMatch(Domain::nonNegative) && n.operands.stream().anyMatch(Domain::positive);
            return n.operands.stream().allMatch(Domain::positive);
        }
        if (e instanceof Pow p) return positive(p.base());
        if (e instanceof Fn f) {
            return switch (f.func()) {
                case EXP -> true;
                case SQRT -> positive(f.arg());
                case ABS -> positive(f.arg());
                default -> false;
            };
        }
        return false;
    }

    /** True only when {@code e} is provably non-negative wherever it is defined. */
    public static boolean nonNegative(Expr e) {
        if (positive(e)) return true;
        if (e instanceof Const c) return c.signum() >= 0;
        if (e instanceof Nary n) return n.operands.stream().allMatch(Domain::nonNegative);
        if (e instanceof Pow p)
            return (p.exponent() instanceof Const c && c.isEvenInteger()) || nonNegative(p.base());
        if (e instanceof Fn f) return f.func() == Fn.Func.ABS || f.func() == Fn.Func.SQRT;
        return false;
    }

    public static boolean nonZero(Expr e) {
        return e instanceof Const c ? !c.isZero() : positive(e);
    }

    /** {@code e} itself when provably positive, otherwise {@code e^2 + 1}. */
    public static Expr guardPositive(Expr e) {
        if (positive(e)) return e;
        if (e instanceof Const c) return c.abs().plus(Const.ONE);
        return add(pow(e, 2), Const.ONE);
    }

    /** {@code e} itself when provably non-negative, otherwise {@code e^2 + 1}. */
    public static Expr guardNonNegative(Expr e) {
        return nonNegative(e) ? e : guardPositive(e);
    }

    /** {@code e} itself when provably non-zero, otherwise {@code e^2 + 1}. */
    public static Expr guardNonZero(Expr e) {
        return nonZero(e) ? e : guardPositive(e);
    }

    /** Polynomial in {@code x}: sums and products of constants, {@code x} and non-negative integer powers. */
    public static boolean polynomial(Expr e, Var x) {
        if (!e.containsVar(x)) return e instanceof Const || e instanceof Var;
        if (e instanceof Var) return true;
        if (e instanceof Nary n) return n.operands.stream().allMatch(o -> polynomial(o, x));
        if (e instanceof Pow p)
            return p.exponent() instanceof Const c && c.isInteger() && c.signum() >= 0 && polynomial(p.base(), x);
        return false;
    }
}
