package dumb.unity;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static dumb.unity.Expr.*;

/**
 * Random base expressions in one variable, by recursive descent over a level's weighted
 * node-kind table. Every branch consumes depth budget, so recursion is bounded by
 * {@link Level#maxDepth}; subtrees that would be undefined are guarded as they are built.
 */
public class Generator {

    static final int MAX_REDRAWS = 64;
    static final int MAX_CONSTANT = 9;
    static final long[] LIMIT_POINTS = {0, 1, -1, 2};

    private final Var x;

    public Generator() {
        this(Level.X);
    }

    public Generator(Var x) {
        this.x = x;
    }

    public Var var() {
        return x;
    }

    /**
     * A base expression for {@code level}: contains the variable, has at least
     * {@link Level#minNodes} nodes and is non-zero wherever it is defined.
     */
    public Expr generate(Level level, Random random) {
        for (var i = 0; i < MAX_REDRAWS; i++) {
            var raw = grow(level, level.maxDepth, true, random);
            if (raw.weight() >= level.minNodes && raw.containsVar(x))
                return Domain.guardNonZero(raw);
        }
        Log.warning("Generator redraw budget spent at " + level + ", using a polynomial base");
        return Domain.guardNonZero(polynomial(level == Level.ELEMENTARY ? 1 : 2, random));
    }

    /** A tree of depth at most {@code budget}. */
    Expr grow(Level level, int budget, boolean root, Random random) {
        if (budget <= 1) return terminal(random);
        var kind = draw(level, budget, root, random);
        return switch (kind) {
            case CONST -> constant(random);
            case VAR -> x;
            case ADD -> add(grow(level, budget - 1, false, random), grow(level, budget - 1, false, random));
            case SUB -> sub(grow(level, budget - 1, false, random), grow(level, budget - 2, false, random));
            case MUL -> mul(grow(level, budget - 1, false, random), grow(level, budget - 1, false, random));
            case POW -> pow(grow(level, budget - 1, false, random), 2 + random.nextInt(level == Level.ELEMENTARY ? 2 : 3));
            case DIV -> mul(grow(level, budget - 1, false, random),
                    inv(Domain.guardPositive(grow(level, budget - 2 - Domain.GUARD_DEPTH, false, random))));
            case SQRT -> fn(Fn.Func.SQRT, Domain.guardNonNegative(grow(level, budget - 1 - Domain.GUARD_DEPTH, false, random)));
            case ROOT -> pow(Domain.guardNonNegative(grow(level, budget - 1 - Domain.GUARD_DEPTH, false, random)),
                    num(1, 2 + random.nextInt(3)));
            case ABS -> fn(Fn.Func.ABS, grow(level, budget - 1, false, random));
            case POLY -> budget >= 5 && random.nextBoolean()
                    ? mul(polynomial(1 + random.nextInt(3), random), polynomial(1 + random.nextInt(2), random))
                    : polynomial(1 + random.nextInt(3), random);
            case SIN -> fn(Fn.Func.SIN, grow(level, budget - 1, false, random));
            case COS -> fn(Fn.Func.COS, grow(level, budget - 1, false, random));
            case EXP -> fn(Fn.Func.EXP, grow(level, budget - 1, false, random));
            case LOG -> fn(Fn.Func.LOG, Domain.guardPositive(grow(level, budget - 1 - Domain.GUARD_DEPTH, false, random)));
            case DERIVATIVE -> new Derivative(grow(level, budget - 1, false, random), x, 1 + random.nextInt(2));
            case INTEGRAL -> {
                var body = grow(level, budget - 1, false, random);
                if (random.nextBoolean()) yield new Integral(body, x);
                var lower = random.nextInt(3) - 1;
                yield new Integral(body, x, num(lower), num(lower + 1 + random.nextInt(3)));
            }
            case LIMIT -> new Limit(grow(level, budget - 1, false, random), x, num(LIMIT_POINTS[random.nextInt(LIMIT_POINTS.length)]));
        };
    }

    private Kind draw(Level level, int budget, boolean root, Random random) {
        List<Kind> kinds = new ArrayList<>();
        var total = 0;
        for (var e : level.weights.entrySet()) {
            var k = e.getKey();
            if (k.minBudget > budget || (root && k.terminal)) continue;
            kinds.add(k);
            total += e.getValue();
        }
        var r = random.nextInt(total);
        for (var k : kinds) {
            r -= level.weights.get(k);
            if (r < 0) return k;
        }
        throw new IllegalStateException("Weighted draw fell through at " + level);
    }

    private Expr terminal(Random random) {
        return random.nextInt(3) == 0 ? constant(random) : x;
    }

    /** A non-zero integer in [-9, 9]. */
    static Const constant(Random random) {
        var n = 1 + random.nextInt(MAX_CONSTANT);
        return num(random.nextBoolean() ? n : -n);
    }

    /** {@code sum c_i x^i} for i = 0..degree with non-zero coefficients; depth at most 4. */
    Expr polynomial(int degree, Random random) {
        var terms = new ArrayList<Expr>(degree + 1);
        for (var i = 0; i <= degree; i++) {
            var c = constant(random);
            terms.add(i == 0 ? c : i == 1 ? mul(c, x) : mul(c, pow(x, i)));
        }
        return new Nary(Nary.Kind.ADD, terms);
    }

    /** Node kinds a level's weight table draws from. {@code minBudget} is the depth a kind needs. */
    public enum Kind {
        CONST(1, true), VAR(1, true),
        ADD(2), SUB(3), MUL(2), POW(2),
        DIV(5), SQRT(4), ROOT(4), ABS(2), POLY(4),
        SIN(2), COS(2), EXP(2), LOG(4),
        DERIVATIVE(2), INTEGRAL(2), LIMIT(2);

        public final int minBudget;
        public final boolean terminal;

        Kind(int minBudget) {
            this(minBudget, false);
        }

        Kind(int minBudget, boolean terminal) {
            this.minBudget = minBudget;
            this.terminal = terminal;
        }
    }
}
