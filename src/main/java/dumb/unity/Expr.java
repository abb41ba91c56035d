package dumb.unity;

import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable expression tree. Leaves are {@link Const} and {@link Var}; every other node
 * owns fully-formed children, so a tree is finite and acyclic by construction.
 */
sealed public interface Expr permits Expr.Const, Expr.Var, Expr.Nary, Expr.Pow, Expr.Fn,
        Expr.Derivative, Expr.Integral, Expr.Limit {

    static Const num(long value) {
        return Const.of(value);
    }

    static Const num(long numerator, long denominator) {
        return Const.of(numerator, denominator);
    }

    static Nary add(Expr... operands) {
        return new Nary(Nary.Kind.ADD, List.of(operands));
    }

    static Nary mul(Expr... operands) {
        return new Nary(Nary.Kind.MUL, List.of(operands));
    }

    static Pow pow(Expr base, Expr exponent) {
        return new Pow(base, exponent);
    }

    static Pow pow(Expr base, long exponent) {
        return new Pow(base, Const.of(exponent));
    }

    static Nary neg(Expr e) {
        return mul(Const.MINUS_ONE, e);
    }

    static Pow inv(Expr e) {
        return pow(e, Const.MINUS_ONE);
    }

    static Nary sub(Expr a, Expr b) {
        return add(a, neg(b));
    }

    static Fn fn(Fn.Func func, Expr arg) {
        return new Fn(func, List.of(arg));
    }

    String toKif();

    /** Node count. */
    int weight();

    /** Longest root-to-leaf path, counting nodes; a leaf has depth 1. */
    int depth();

    boolean containsVar(Var v);

    List<Expr> children();

    JSONObject toJson();

    default boolean is(Const c) {
        return c.equals(this);
    }

    /** Replaces free occurrences of {@code v}. */
    default Expr replace(Var v, Expr value) {
        if (!containsVar(v)) return this;
        if (this instanceof Var) return value;
        if (this instanceof Nary n)
            return new Nary(n.kind, n.operands.stream().map(o -> o.replace(v, value)).collect(Collectors.toList()));
        if (this instanceof Pow p)
            return new Pow(p.base().replace(v, value), p.exponent().replace(v, value));
        if (this instanceof Fn f)
            return new Fn(f.func(), f.args().stream().map(a -> a.replace(v, value)).collect(Collectors.toList()));
        if (this instanceof Derivative d) {
            if (d.var().equals(v))
                throw new IllegalArgumentException("Cannot substitute into a derivative with respect to " + v.name());
            return new Derivative(d.body().replace(v, value), d.var(), d.order());
        }
        if (this instanceof Integral i) {
            if (i.var().equals(v) && !i.definite())
                throw new IllegalArgumentException("Cannot substitute into an antiderivative in " + v.name());
            return new Integral(i.var().equals(v) ? i.body() : i.body().replace(v, value), i.var(),
                    i.lower() == null ? null : i.lower().replace(v, value),
                    i.upper() == null ? null : i.upper().replace(v, value));
        }
        if (this instanceof Limit l)
            return new Limit(l.var().equals(v) ? l.body() : l.body().replace(v, value), l.var(), l.point().replace(v, value));
        throw new IllegalStateException("Unhandled node " + getClass().getSimpleName());
    }

    /** Exact rational constant; the fraction is kept in lowest terms with a positive denominator. */
    record Const(BigInteger num, BigInteger den) implements Expr, Comparable<Const> {
        public static final Const ZERO = new Const(BigInteger.ZERO, BigInteger.ONE);
        public static final Const ONE = new Const(BigInteger.ONE, BigInteger.ONE);
        public static final Const MINUS_ONE = new Const(BigInteger.ONE.negate(), BigInteger.ONE);
        public static final Const TWO = new Const(BigInteger.TWO, BigInteger.ONE);
        public static final Const HALF = new Const(BigInteger.ONE, BigInteger.TWO);

        public Const {
            requireNonNull(num);
            requireNonNull(den);
            if (den.signum() == 0)
                throw new IllegalArgumentException("Zero denominator in constant " + num + "/0");
            if (den.signum() < 0) {
                num = num.negate();
                den = den.negate();
            }
            var g = num.gcd(den);
            if (!g.equals(BigInteger.ONE) && g.signum() != 0) {
                num = num.divide(g);
                den = den.divide(g);
            }
        }

        public static Const of(long value) {
            return new Const(BigInteger.valueOf(value), BigInteger.ONE);
        }

        public static Const of(long numerator, long denominator) {
            return new Const(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
        }

        public boolean isInteger() {
            return den.equals(BigInteger.ONE);
        }

        public boolean isZero() {
            return num.signum() == 0;
        }

        public int signum() {
            return num.signum();
        }

        public boolean isEvenInteger() {
            return isInteger() && !num.testBit(0);
        }

        public Const plus(Const o) {
            return new Const(num.multiply(o.den).add(o.num.multiply(den)), den.multiply(o.den));
        }

        public Const times(Const o) {
            return new Const(num.multiply(o.num), den.multiply(o.den));
        }

        public Const negate() {
            return new Const(num.negate(), den);
        }

        public Const abs() {
            return signum() < 0 ? negate() : this;
        }

        public Const reciprocal() {
            if (isZero()) throw new DomainGuardViolation("Reciprocal of zero");
            return new Const(den, num);
        }

        /** Integer power; negative exponents of zero are undefined. */
        public Const pow(int exponent) {
            if (exponent < 0) return reciprocal().pow(-exponent);
            return new Const(num.pow(exponent), den.pow(exponent));
        }

        /** Exact {@code n}-th root when one exists among the rationals. */
        @Nullable
        public Const root(int n) {
            if (n <= 0) throw new IllegalArgumentException("Root degree must be positive: " + n);
            if (signum() < 0 && n % 2 == 0) return null;
            var rn = integerRoot(num.abs(), n);
            var rd = integerRoot(den, n);
            if (rn == null || rd == null) return null;
            return new Const(signum() < 0 ? rn.negate() : rn, rd);
        }

        @Nullable
        private static BigInteger integerRoot(BigInteger value, int n) {
            if (value.signum() == 0 || value.equals(BigInteger.ONE)) return value;
            var lo = BigInteger.ONE;
            var hi = BigInteger.ONE.shiftLeft(value.bitLength() / n + 1);
            while (lo.compareTo(hi) <= 0) {
                var mid = lo.add(hi).shiftRight(1);
                var p = mid.pow(n);
                var c = p.compareTo(value);
                if (c == 0) return mid;
                if (c < 0) lo = mid.add(BigInteger.ONE);
                else hi = mid.subtract(BigInteger.ONE);
            }
            return null;
        }

        public int intValueExact() {
            if (!isInteger()) throw new ArithmeticException("Not an integer: " + toKif());
            return num.intValueExact();
        }

        @Override
        public int compareTo(Const o) {
            return num.multiply(o.den).compareTo(o.num.multiply(den));
        }

        @Override
        public String toKif() {
            return isInteger() ? num.toString() : num + "/" + den;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean containsVar(Var v) {
            return false;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "const")
                    .put("value", toKif());
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }
    }

    record Var(String name) implements Expr {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(16);

        public Var {
            requireNonNull(name);
            if (name.isEmpty() || !Character.isLetter(name.charAt(0)))
                throw new IllegalArgumentException("Variable name must start with a letter: '" + name + "'");
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public String toKif() {
            return name;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean containsVar(Var v) {
            return equals(v);
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Sum or product of an ordered operand sequence. */
    final class Nary implements Expr {
        public final Kind kind;
        public final List<Expr> operands;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated = false;
        private volatile String kifStringCache;
        private volatile int weightCache = -1, depthCache = -1;

        public Nary(Kind kind, List<Expr> operands) {
            this.kind = requireNonNull(kind);
            this.operands = List.copyOf(operands);
        }

        public Nary(Kind kind, Expr... operands) {
            this(kind, Arrays.asList(operands));
        }

        public Expr get(int index) {
            return operands.get(index);
        }

        public int size() {
            return operands.size();
        }

        public boolean is(Kind k) {
            return kind == k;
        }

        @Override
        public String toKif() {
            if (kifStringCache == null)
                kifStringCache = operands.stream().map(Expr::toKif).collect(Collectors.joining(" ", "(" + kind.symbol + " ", ")"));
            return kifStringCache;
        }

        @Override
        public int weight() {
            if (weightCache == -1) weightCache = 1 + operands.stream().mapToInt(Expr::weight).sum();
            return weightCache;
        }

        @Override
        public int depth() {
            if (depthCache == -1) depthCache = 1 + operands.stream().mapToInt(Expr::depth).max().orElse(0);
            return depthCache;
        }

        @Override
        public boolean containsVar(Var v) {
            for (var o : operands)
                if (o.containsVar(v)) return true;
            return false;
        }

        @Override
        public List<Expr> children() {
            return operands;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Nary that && kind == that.kind && this.hashCode() == that.hashCode() && operands.equals(that.operands));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = 31 * kind.hashCode() + operands.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }

        @Override
        public JSONObject toJson() {
            var jsonOperands = new JSONArray();
            operands.forEach(o -> jsonOperands.put(o.toJson()));
            return new JSONObject()
                    .put("type", kind == Kind.ADD ? "add" : "mul")
                    .put("operands", jsonOperands);
        }

        public enum Kind {
            ADD("+"), MUL("*");

            public final String symbol;

            Kind(String symbol) {
                this.symbol = symbol;
            }
        }
    }

    record Pow(Expr base, Expr exponent) implements Expr {
        public Pow {
            requireNonNull(base);
            requireNonNull(exponent);
        }

        @Override
        public String toKif() {
            return "(^ " + base.toKif() + " " + exponent.toKif() + ")";
        }

        @Override
        public int weight() {
            return 1 + base.weight() + exponent.weight();
        }

        @Override
        public int depth() {
            return 1 + Math.max(base.depth(), exponent.depth());
        }

        @Override
        public boolean containsVar(Var v) {
            return base.containsVar(v) || exponent.containsVar(v);
        }

        @Override
        public List<Expr> children() {
            return List.of(base, exponent);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "pow")
                    .put("base", base.toJson())
                    .put("exponent", exponent.toJson());
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }
    }

    record Fn(Func func, List<Expr> args) implements Expr {
        public Fn {
            requireNonNull(func);
            args = List.copyOf(args);
            if (args.size() != func.arity)
                throw new IllegalArgumentException(func.symbol + " takes " + func.arity + " argument(s), got " + args.size());
        }

        public Expr arg() {
            return args.get(0);
        }

        @Override
        public String toKif() {
            return args.stream().map(Expr::toKif).collect(Collectors.joining(" ", "(" + func.symbol + " ", ")"));
        }

        @Override
        public int weight() {
            return 1 + args.stream().mapToInt(Expr::weight).sum();
        }

        @Override
        public int depth() {
            return 1 + args.stream().mapToInt(Expr::depth).max().orElse(0);
        }

        @Override
        public boolean containsVar(Var v) {
            return args.stream().anyMatch(a -> a.containsVar(v));
        }

        @Override
        public List<Expr> children() {
            return args;
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject()
                    .put("type", "fn")
                    .put("name", func.symbol)
                    .put("args", jsonArgs);
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }

        public enum Func {
            SIN("sin"), COS("cos"), EXP("exp"), LOG("log"), SQRT("sqrt"), ABS("abs");

            public final String symbol;
            public final int arity = 1;

            Func(String symbol) {
                this.symbol = symbol;
            }

            @Nullable
            public static Func of(String symbol) {
                for (var f : values())
                    if (f.symbol.equals(symbol)) return f;
                return null;
            }
        }
    }

    record Derivative(Expr body, Var var, int order) implements Expr {
        public Derivative {
            requireNonNull(body);
            requireNonNull(var);
            if (order < 1) throw new IllegalArgumentException("Derivative order must be positive: " + order);
        }

        @Override
        public String toKif() {
            return "(d " + body.toKif() + " " + var.toKif() + " " + order + ")";
        }

        @Override
        public int weight() {
            return 1 + body.weight() + 1;
        }

        @Override
        public int depth() {
            return 1 + body.depth();
        }

        @Override
        public boolean containsVar(Var v) {
            return body.containsVar(v);
        }

        @Override
        public List<Expr> children() {
            return List.of(body);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "derivative")
                    .put("body", body.toJson())
                    .put("var", var.name())
                    .put("order", order);
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }
    }

    /** Indefinite when both bounds are null, definite otherwise. */
    record Integral(Expr body, Var var, @Nullable Expr lower, @Nullable Expr upper) implements Expr {
        public Integral {
            requireNonNull(body);
            requireNonNull(var);
            if ((lower == null) != (upper == null))
                throw new IllegalArgumentException("Integral bounds must be given together");
        }

        public Integral(Expr body, Var var) {
            this(body, var, null, null);
        }

        public boolean definite() {
            return lower != null;
        }

        @Override
        public String toKif() {
            return "(int " + body.toKif() + " " + var.toKif() + (definite() ? " " + lower.toKif() + " " + upper.toKif() : "") + ")";
        }

        @Override
        public int weight() {
            return 1 + body.weight() + 1 + (definite() ? lower.weight() + upper.weight() : 0);
        }

        @Override
        public int depth() {
            return 1 + children().stream().mapToInt(Expr::depth).max().orElse(0);
        }

        @Override
        public boolean containsVar(Var v) {
            if (definite() && (lower.containsVar(v) || upper.containsVar(v))) return true;
            return !var.equals(v) ? body.containsVar(v) : !definite() && body.containsVar(v);
        }

        @Override
        public List<Expr> children() {
            if (!definite()) return List.of(body);
            var c = new ArrayList<Expr>(3);
            c.add(body);
            c.add(lower);
            c.add(upper);
            return c;
        }

        @Override
        public JSONObject toJson() {
            var json = new JSONObject()
                    .put("type", "integral")
                    .put("body", body.toJson())
                    .put("var", var.name());
            if (definite()) json.put("lower", lower.toJson()).put("upper", upper.toJson());
            return json;
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }
    }

    record Limit(Expr body, Var var, Expr point) implements Expr {
        public Limit {
            requireNonNull(body);
            requireNonNull(var);
            requireNonNull(point);
        }

        @Override
        public String toKif() {
            return "(lim " + body.toKif() + " " + var.toKif() + " " + point.toKif() + ")";
        }

        @Override
        public int weight() {
            return 1 + body.weight() + 1 + point.weight();
        }

        @Override
        public int depth() {
            return 1 + Math.max(body.depth(), point.depth());
        }

        @Override
        public boolean containsVar(Var v) {
            return (!var.equals(v) && body.containsVar(v)) || point.containsVar(v);
        }

        @Override
        public List<Expr> children() {
            return List.of(body, point);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "limit")
                    .put("body", body.toJson())
                    .put("var", var.name())
                    .put("point", point.toJson());
        }

        @Override
        public String toString() {
            return Infix.render(this);
        }
    }
}
