package dumb.unity;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static dumb.unity.Expr.*;

/**
 * LaTeX rendering for a client-side typesetter. Products with negative integer powers
 * become fractions, {@code 1/n} powers become radicals.
 */
public enum Latex {
    ;

    private static final int SUM = 1, PRODUCT = 2, POWER = 3, ATOM = 4;

    public static String render(Expr e) {
        return render(e, 0);
    }

    private static String render(Expr e, int context) {
        var prec = precedence(e);
        var s = body(e);
        return prec < context ? "\\left(" + s + "\\right)" : s;
    }

    private static int precedence(Expr e) {
        if (e instanceof Const c) return c.isInteger() && c.signum() >= 0 ? ATOM : PRODUCT;
        if (e instanceof Nary n) return n.kind == Nary.Kind.ADD ? SUM : PRODUCT;
        if (e instanceof Pow p) return radical(p) || reciprocal(p) ? ATOM : POWER;
        if (e instanceof Fn f && f.func() == Fn.Func.EXP) return POWER;
        return ATOM;
    }

    private static boolean radical(Pow p) {
        return p.exponent() instanceof Const c && !c.isInteger() && c.signum() > 0;
    }

    private static boolean reciprocal(Pow p) {
        return p.exponent() instanceof Const c && c.isInteger() && c.signum() < 0;
    }

    private static String body(Expr e) {
        if (e instanceof Const c)
            return c.isInteger() ? c.toKif() : (c.signum() < 0 ? "-" : "") + "\\frac{" + c.num().abs() + "}{" + c.den() + "}";
        if (e instanceof Var v) return v.name();
        if (e instanceof Nary n) return n.kind == Nary.Kind.ADD ? sum(n) : product(n.operands);
        if (e instanceof Pow p) return pow(p);
        if (e instanceof Fn f) return fn(f);
        if (e instanceof Derivative d) {
            var x = d.var().name();
            var op = d.order() == 1
                    ? "\\frac{d}{d" + x + "}"
                    : "\\frac{d^{" + d.order() + "}}{d" + x + "^{" + d.order() + "}}";
            return op + "\\left(" + render(d.body(), 0) + "\\right)";
        }
        if (e instanceof Integral i) {
            var bounds = i.definite() ? "_{" + render(i.lower(), 0) + "}^{" + render(i.upper(), 0) + "}" : "";
            return "\\int" + bounds + " " + render(i.body(), PRODUCT) + " \\, d" + i.var().name();
        }
        if (e instanceof Limit l)
            return "\\lim_{" + l.var().name() + " \\to " + render(l.point(), 0) + "} " + render(l.body(), PRODUCT);
        throw new IllegalStateException("Unhandled node " + e.getClass().getSimpleName());
    }

    private static String sum(Nary n) {
        var sb = new StringBuilder();
        for (var i = 0; i < n.size(); i++) {
            var t = n.get(i);
            var negated = Infix.negated(t);
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

    private static String product(List<Expr> factors) {
        List<Expr> numer = new ArrayList<>(factors.size()), denom = new ArrayList<>();
        var sign = "";
        for (var f : factors) {
            if (f instanceof Pow p && reciprocal(p)) {
                var k = ((Const) p.exponent()).negate();
                denom.add(k.is(Const.ONE) ? p.base() : new Pow(p.base(), k));
            } else if (f instanceof Const c && !c.isInteger()) {
                if (c.signum() < 0) sign = sign.isEmpty() ? "-" : "";
                if (!c.num().abs().equals(BigInteger.ONE)) numer.add(new Const(c.num().abs(), BigInteger.ONE));
                denom.add(new Const(c.den(), BigInteger.ONE));
            } else if (f.is(Const.MINUS_ONE) && factors.size() > 1) {
                sign = sign.isEmpty() ? "-" : "";
            } else {
                numer.add(f);
            }
        }
        if (denom.isEmpty()) return sign + joinFactors(numer);
        return sign + "\\frac{" + joinFactors(numer) + "}{" + joinFactors(denom) + "}";
    }

    private static String joinFactors(List<Expr> factors) {
        if (factors.isEmpty()) return "1";
        if (factors.size() == 1) return render(factors.get(0), 0);
        var sb = new StringBuilder();
        for (var i = 0; i < factors.size(); i++) {
            if (i > 0) sb.append(" \\cdot ");
            sb.append(render(factors.get(i), PRODUCT + (i > 0 ? 1 : 0)));
        }
        return sb.toString();
    }

    private static String pow(Pow p) {
        if (reciprocal(p)) return product(List.of(p));
        if (radical(p)) {
            var c = (Const) p.exponent();
            var radicand = c.num().equals(BigInteger.ONE)
                    ? render(p.base(), 0)
                    : render(p.base(), ATOM) + "^{" + c.num() + "}";
            return c.den().equals(BigInteger.TWO)
                    ? "\\sqrt{" + radicand + "}"
                    : "\\sqrt[" + c.den() + "]{" + radicand + "}";
        }
        if (p.base() instanceof Fn f && p.exponent() instanceof Const c && c.isInteger() && c.signum() > 0
                && f.func() != Fn.Func.SQRT && f.func() != Fn.Func.ABS && f.func() != Fn.Func.EXP)
            return "\\" + f.func().symbol + "^{" + c.toKif() + "}\\left(" + render(f.arg(), 0) + "\\right)";
        return render(p.base(), ATOM) + "^{" + render(p.exponent(), 0) + "}";
    }

    private static String fn(Fn f) {
        var arg = render(f.arg(), 0);
        return switch (f.func()) {
            case SQRT -> "\\sqrt{" + arg + "}";
            case ABS -> "\\left|" + arg + "\\right|";
            case EXP -> "e^{" + arg + "}";
            default -> "\\" + f.func().symbol + "\\left(" + arg + "\\right)";
        };
    }
}
