package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static dumb.unity.Expr.*;

/**
 * Bounded rewriting to a fixed point. Each pass rewrites bottom-up; passes repeat until the
 * tree stops changing or the iteration cap is hit. The rule set covers arithmetic folding,
 * like terms and like bases, exponent laws with integer outer exponents, the Pythagorean
 * identity, elementary function values, and evaluation of derivatives, polynomial integrals
 * and limits whose body is continuous at the point.
 */
public class Simplifier {

    public static final int DEFAULT_ITERATION_CAP = 64;

    /** Integer exponents beyond this many bits are left unfolded. */
    private static final int MAX_FOLD_EXPONENT_BITS = 10;

    private final int iterationCap;

    public Simplifier() {
        this(DEFAULT_ITERATION_CAP);
    }

    public Simplifier(int iterationCap) {
        if (iterationCap < 1) throw new IllegalArgumentException("Iteration cap must be positive: " + iterationCap);
        this.iterationCap = iterationCap;
    }

    public int iterationCap() {
        return iterationCap;
    }

    /**
     * @throws DomainGuardViolation when a rewrite meets an undefined operation
     */
    public Result simplify(Expr e) {
        var current = e;
        for (var i = 1; i <= iterationCap; i++) {
            var next = pass(current);
            if (next.equals(current)) return new Result(current, i, true);
            current = next;
        }
        return new Result(current, iterationCap, false);
    }

    /** One bottom-up rewrite of every node. */
    public Expr pass(Expr e) {
        if (e instanceof Const || e instanceof Var) return e;
        if (e instanceof Nary n) {
            var ops = n.operands.stream().map(this::pass).collect(Collectors.toList());
            return n.kind == Nary.Kind.ADD ? sum(ops) : product(ops);
        }
        if (e instanceof Pow p) return power(pass(p.base()), pass(p.exponent()));
        if (e instanceof Fn f) return function(f.func(), pass(f.arg()));
        if (e instanceof Derivative d) return derivative(pass(d.body()), d.var(), d.order());
        if (e instanceof Integral i)
            return integral(pass(i.body()), i.var(),
                    i.lower() == null ? null : pass(i.lower()),
                    i.upper() == null ? null : pass(i.upper()));
        if (e instanceof Limit l) return limit(pass(l.body()), l.var(), pass(l.point()));
        throw new IllegalStateException("Unhandled node " + e.getClass().getSimpleName());
    }

    static Expr sum(List<Expr> operands) {
        var constant = Const.ZERO;
        Map<Expr, Const> terms = new LinkedHashMap<>();
        for (var t : flatten(Nary.Kind.ADD, operands)) {
            if (t instanceof Const c) {
                constant = constant.plus(c);
                continue;
            }
            var term = split(t);
            if (term.key() == null) constant = constant.plus(term.coefficient());
            else terms.merge(term.key(), term.coefficient(), Const::plus);
        }

        // a sin(A)^2 + b cos(A)^2 = b + (a - b) sin(A)^2
        for (var key : new ArrayList<>(terms.keySet())) {
            var arg = squaredArgument(key, Fn.Func.SIN);
            if (arg == null) continue;
            var cosKey = new Pow(new Fn(Fn.Func.COS, List.of(arg)), Const.TWO);
            var a = terms.get(key);
            var b = terms.get(cosKey);
            if (a == null || b == null) continue;
            constant = constant.plus(b);
            terms.remove(cosKey);
            terms.put(key, a.plus(b.negate()));
        }

        var out = new ArrayList<Expr>(terms.size() + 1);
        terms.forEach((key, coefficient) -> {
            if (!coefficient.isZero()) out.add(scaled(coefficient, key));
        });
        if (out.isEmpty()) return constant;
        if (!constant.isZero()) out.add(constant);
        if (out.size() == 1) return out.get(0);
        out.sort(ExprOrder.INSTANCE);
        return new Nary(Nary.Kind.ADD, out);
    }

    static Expr product(List<Expr> operands) {
        return product(operands, true);
    }

    /** With {@code distribute}, a rational times a lone sum is expanded into the sum. */
    private static Expr product(List<Expr> operands, boolean distribute) {
        var constant = Const.ONE;
        Map<Expr, List<Expr>> powers = new LinkedHashMap<>();
        for (var f : flatten(Nary.Kind.MUL, operands)) {
            if (f instanceof Const c) constant = constant.times(c);
            else if (f instanceof Pow p) powers.computeIfAbsent(p.base(), k -> new ArrayList<>()).add(p.exponent());
            else powers.computeIfAbsent(f, k -> new ArrayList<>()).add(Const.ONE);
        }
        if (constant.isZero()) return Const.ZERO;

        var factors = new ArrayList<Expr>(powers.size());
        for (var entry : powers.entrySet()) {
            var factor = power(entry.getKey(), sum(entry.getValue()));
            if (factor instanceof Const c) {
                constant = constant.times(c);
            } else if (factor instanceof Nary n && n.kind == Nary.Kind.MUL) {
                for (var o : n.operands) {
                    if (o instanceof Const c) constant = constant.times(c);
                    else factors.add(o);
                }
            } else {
                factors.add(factor);
            }
        }
        if (constant.isZero()) return Const.ZERO;
        if (factors.isEmpty()) return constant;

        if (factors.size() == 1) {
            var only = factors.get(0);
            if (constant.is(Const.ONE)) return only;
            if (distribute && only instanceof Nary s && s.kind == Nary.Kind.ADD) {
                final var c = constant;
                return sum(s.operands.stream().map(t -> product(List.of(c, t))).collect(Collectors.toList()));
            }
        }
        factors.sort(ExprOrder.INSTANCE);
        if (!constant.is(Const.ONE)) factors.add(0, constant);
        return new Nary(Nary.Kind.MUL, factors);
    }

    static Expr power(Expr base, Expr exponent) {
        if (base.is(Const.ONE)) return Const.ONE;
        if (!(exponent instanceof Const k)) return new Pow(base, exponent);
        if (k.isZero()) return Const.ONE;
        if (k.is(Const.ONE)) return base;

        if (base instanceof Const c) {
            if (k.isInteger()) {
                if (k.num().bitLength() > MAX_FOLD_EXPONENT_BITS) return new Pow(base, exponent);
                if (c.isZero() && k.signum() < 0)
                    throw new DomainGuardViolation("Division by zero: 0^" + k.toKif());
                return c.pow(k.intValueExact());
            }
            if (c.signum() >= 0 && k.den().bitLength() <= MAX_FOLD_EXPONENT_BITS) {
                var root = c.root(k.den().intValueExact());
                if (root != null) return power(root, new Const(k.num(), BigInteger.ONE));
            }
            return new Pow(base, exponent);
        }

        if (k.isInteger()) {
            if (base instanceof Pow p)
                return power(p.base(), product(List.of(p.exponent(), k)));
            // (c g)^k stays c^k g^k so it still groups with c g on the base g
            if (base instanceof Nary n && n.kind == Nary.Kind.MUL)
                return product(n.operands.stream().map(o -> power(o, k)).collect(Collectors.toList()), false);
        }
        return new Pow(base, exponent);
    }

    static Expr function(Fn.Func func, Expr a) {
        switch (func) {
            case ABS -> {
                if (a instanceof Const c) return c.abs();
                if (Domain.nonNegative(a)) return a;
            }
            case SQRT -> {
                if (a instanceof Const c) {
                    if (c.signum() < 0) throw new DomainGuardViolation("Square root of negative constant " + c.toKif());
                    var root = c.root(2);
                    if (root != null) return root;
                }
                if (a instanceof Pow p && p.exponent() instanceof Const k && k.isEvenInteger() && k.signum() > 0)
                    return power(function(Fn.Func.ABS, p.base()), k.times(Const.HALF));
            }
            case EXP -> {
                if (a.is(Const.ZERO)) return Const.ONE;
                if (a instanceof Fn f && f.func() == Fn.Func.LOG) return f.arg();
            }
            case LOG -> {
                if (a.is(Const.ONE)) return Const.ZERO;
                if (a instanceof Const c && c.signum() <= 0)
                    throw new DomainGuardViolation("Logarithm of non-positive constant " + c.toKif());
                if (a instanceof Fn f && f.func() == Fn.Func.EXP) return f.arg();
            }
            case SIN -> {
                if (a.is(Const.ZERO)) return Const.ZERO;
            }
            case COS -> {
                if (a.is(Const.ZERO)) return Const.ONE;
            }
        }
        return new Fn(func, List.of(a));
    }

    Expr derivative(Expr body, Var x, int order) {
        var result = body;
        for (var i = 0; i < order; i++) {
            var d = Derivatives.differentiate(result, x);
            if (d == null) return new Derivative(result, x, order - i);
            result = d;
        }
        return result;
    }

    static Expr integral(Expr body, Var x, @Nullable Expr lower, @Nullable Expr upper) {
        var definite = lower != null;
        var anti = Derivatives.antiderivative(body, x);
        if (anti == null) return new Integral(body, x, lower, upper);
        if (!definite) return anti;
        return sum(List.of(anti.replace(x, upper), product(List.of(Const.MINUS_ONE, anti.replace(x, lower)))));
    }

    static Expr limit(Expr body, Var x, Expr point) {
        if (!body.containsVar(x)) return body;
        if (Domain.polynomial(body, x)) return body.replace(x, point);
        return new Limit(body, x, point);
    }

    private static List<Expr> flatten(Nary.Kind kind, List<Expr> operands) {
        var flat = new ArrayList<Expr>(operands.size());
        for (var o : operands) {
            if (o instanceof Nary n && n.kind == kind) flat.addAll(flatten(kind, n.operands));
            else flat.add(o);
        }
        return flat;
    }

    /** Splits a summand into its rational coefficient and the remaining product, null when purely numeric. */
    private static Term split(Expr t) {
        if (!(t instanceof Nary n) || n.kind != Nary.Kind.MUL) return new Term(Const.ONE, t);
        var coefficient = Const.ONE;
        var rest = new ArrayList<Expr>(n.size());
        for (var o : n.operands) {
            if (o instanceof Const c) coefficient = coefficient.times(c);
            else rest.add(o);
        }
        if (rest.isEmpty()) return new Term(coefficient, null);
        if (rest.size() == 1) return new Term(coefficient, rest.get(0));
        rest.sort(ExprOrder.INSTANCE);
        return new Term(coefficient, new Nary(Nary.Kind.MUL, rest));
    }

    private static Expr scaled(Const coefficient, Expr key) {
        if (coefficient.is(Const.ONE)) return key;
        var factors = new ArrayList<Expr>();
        factors.add(coefficient);
        if (key instanceof Nary n && n.kind == Nary.Kind.MUL) factors.addAll(n.operands);
        else factors.add(key);
        return new Nary(Nary.Kind.MUL, factors);
    }

    @Nullable
    private static Expr squaredArgument(Expr key, Fn.Func func) {
        if (key instanceof Pow p && p.exponent().is(Const.TWO) && p.base() instanceof Fn f && f.func() == func)
            return f.arg();
        return null;
    }

    private record Term(Const coefficient, @Nullable Expr key) {
    }

    public record Result(Expr normalForm, int iterations, boolean fixedPoint) {
    }
}
