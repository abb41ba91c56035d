package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;

import static dumb.unity.Expr.*;

/** Plain infix text, the human-readable counterpart of {@link Expr#toKif()}. */
enum Infix {
    ;

    private static final int SUM = 1, PRODUCT = 2, POWER = 3, ATOM = 4;

    static String render(Expr e) {
        return render(e, 0);
    }

    private static String render(Expr e, int context) {
        var prec = precedence(e);
        var s = body(e);
        return prec < context ? "(" + s + ")" : s;
    }

    private static int precedence(Expr e) {
        if (e instanceof Const c) return c.isInteger() && c.signum() >= 0 ? ATOM : PRODUCT;
        if (e instanceof Nary n) return n.kind == Nary.Kind.ADD ? SUM : PRODUCT;
        if (e instanceof Pow) return POWER;
        return ATOM;
    }

    private static String body(Expr e) {
        if (e instanceof Const c) return c.toKif();
        if (e instanceof Var v) return v.name();
        if (e instanceof Nary n) return n.kind == Nary.Kind.ADD ? sum(n) : product(n);
        if (e instanceof Pow p) {
            var exp = p.exponent() instanceof Const c && c.isInteger() && c.signum() >= 0
                    ? c.toKif() : "(" + render(p.exponent(), 0) + ")";
            return render(p.base(), ATOM) + "^" + exp;
        }
        if (e instanceof Fn f) return f.func().symbol + "(" + render(f.arg(), 0) + ")";
        if (e instanceof Derivative d) {
            var x = d.var().name();
            var op = d.order() == 1 ? "d/d" + x : "d^" + d.order() + "/d" + x + "^" + d.order();
            return op + "(" + render(d.body(), 0) + ")";
        }
        if (e instanceof Integral i) {
            var bounds = i.definite() ? ", " + render(i.lower(), 0) + ", " + render(i.upper(), 0) : "";
            return "integral(" + render(i.body(), 0) + ", " + i.var().name() + bounds + ")";
        }
        if (e instanceof Limit l)
            return "limit(" + render(l.body(), 0) + ", " + l.var().name() + " -> " + render(l.point(), 0) + ")";
        throw new IllegalStateException("Unhandled node " + e.getClass().getSimpleName());
    }

    private static String sum(Nary n) {
        var sb = new StringBuilder();
        for (var i = 0; i < n.size(); i++) {
            var t = n.get(i);
            var negated = negated(t);
            if (i == 0) {
                sb.append(negated != null ? "-" + render(negated, PRODUCT) : render(t, SUM));
            } else if (negated != null) {
                sb.append(" - ").append(render(negated, PRODUCT));
            } else {
                sb.append(" + ").append(render(t, SUM + 1));
            }
        }
        return sb.toString();
    }

    private static String product(Nary n) {
        if (n.size() >= 2 && n.get(0).is(Const.MINUS_ONE))
            return "-" + render(n.size() == 2 ? n.get(1) : new Nary(Nary.Kind.MUL, n.operands.subList(1, n.size())), POWER);
        var sb = new StringBuilder();
        for (var i = 0; i < n.size(); i++) {
            if (i > 0) sb.append("*");
            sb.append(render(n.get(i), PRODUCT + (i > 0 ? 1 : 0)));
        }
        return sb.toString();
    }

    /** The positive part of a term that prints with a leading minus, or null. */
    @Nullable
    static Expr negated(Expr t) {
        if (t instanceof Const c && c.signum() < 0) return c.negate();
        if (t instanceof Nary n && n.kind == Nary.Kind.MUL && n.size() >= 2 && n.get(0) instanceof Const c && c.signum() < 0) {
            var rest = n.operands.subList(1, n.size());
            if (c.is(Const.MINUS_ONE)) return rest.size() == 1 ? rest.get(0) : new Nary(Nary.Kind.MUL, rest);
            var factors = new ArrayList<Expr>(n.operands);
            factors.set(0, c.negate());
            return new Nary(Nary.Kind.MUL, factors);
        }
        return null;
    }
}
