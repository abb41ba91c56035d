package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static dumb.unity.Expr.*;

/**
 * Symbolic calculus used by the {@link Simplifier}. Results are raw trees; the rewriter
 * normalizes them on its next pass. A null result means the tree contains a node whose
 * derivative or antiderivative is not known here.
 */
enum Derivatives {
    ;

    @Nullable
    static Expr differentiate(Expr e, Var x) {
        if (!e.containsVar(x)) return Const.ZERO;
        if (e instanceof Var) return Const.ONE;
        if (e instanceof Nary n) return n.kind == Nary.Kind.ADD ? sumRule(n, x) : productRule(n, x);
        if (e instanceof Pow p) return powerRule(p, x);
        if (e instanceof Fn f) return chainRule(f, x);
        if (e instanceof Integral i && !i.definite() && i.var().equals(x)) return i.body();
        return null;
    }

    @Nullable
    private static Expr sumRule(Nary n, Var x) {
        var terms = new ArrayList<Expr>(n.size());
        for (var o : n.operands) {
            var d = differentiate(o, x);
            if (d == null) return null;
            terms.add(d);
        }
        return new Nary(Nary.Kind.ADD, terms);
    }

    @Nullable
    private static Expr productRule(Nary n, Var x) {
        var terms = new ArrayList<Expr>(n.size());
        for (var i = 0; i < n.size(); i++) {
            if (!n.get(i).containsVar(x)) continue;
            var d = differentiate(n.get(i), x);
            if (d == null) return null;
            var factors = new ArrayList<>(n.operands);
            factors.set(i, d);
            terms.add(new Nary(Nary.Kind.MUL, factors));
        }
        if (terms.isEmpty()) return Const.ZERO;
        return terms.size() == 1 ? terms.get(0) : new Nary(Nary.Kind.ADD, terms);
    }

    @Nullable
    private static Expr powerRule(Pow p, Var x) {
        var b = p.base();
        var k = p.exponent();
        if (!k.containsVar(x)) {
            var db = differentiate(b, x);
            return db == null ? null : mul(k, pow(b, add(k, Const.MINUS_ONE)), db);
        }
        var dk = differentiate(k, x);
        if (dk == null) return null;
        if (!b.containsVar(x)) return mul(p, fn(Fn.Func.LOG, b), dk);
        var db = differentiate(b, x);
        if (db == null) return null;
        return mul(p, add(mul(dk, fn(Fn.Func.LOG, b)), mul(k, db, inv(b))));
    }

    @Nullable
    private static Expr chainRule(Fn f, Var x) {
        var a = f.arg();
        var da = differentiate(a, x);
        if (da == null) return null;
        return switch (f.func()) {
            case SIN -> mul(fn(Fn.Func.COS, a), da);
            case COS -> mul(Const.MINUS_ONE, fn(Fn.Func.SIN, a), da);
            case EXP -> mul(f, da);
            case LOG -> mul(da, inv(a));
            case SQRT -> mul(Const.HALF, inv(f), da);
            case ABS -> mul(a, inv(f), da);
        };
    }

    /** Antiderivative of an expanded polynomial in {@code x}, without a constant of integration. */
    @Nullable
    static Expr antiderivative(Expr e, Var x) {
        if (e instanceof Nary n && n.kind == Nary.Kind.ADD) {
            var terms = new ArrayList<Expr>(n.size());
            for (var t : n.operands) {
                var a = monomial(t, x);
                if (a == null) return null;
                terms.add(a);
            }
            return new Nary(Nary.Kind.ADD, terms);
        }
        return monomial(e, x);
    }

    @Nullable
    private static Expr monomial(Expr t, Var x) {
        if (!t.containsVar(x)) return mul(t, x);
        List<Expr> factors = t instanceof Nary n && n.kind == Nary.Kind.MUL ? n.operands : List.of(t);
        var coefficient = new ArrayList<Expr>(factors.size() + 2);
        Const degree = null;
        for (var f : factors) {
            if (!f.containsVar(x)) {
                coefficient.add(f);
            } else if (degree == null && f.equals(x)) {
                degree = Const.ONE;
            } else if (degree == null && f instanceof Pow p && p.base().equals(x)
                    && p.exponent() instanceof Const k && k.isInteger() && k.signum() >= 0) {
                degree = k;
            } else {
                return null;
            }
        }
        var next = degree.plus(Const.ONE);
        coefficient.add(next.reciprocal());
        coefficient.add(pow(x, next));
        return new Nary(Nary.Kind.MUL, coefficient);
    }
}
