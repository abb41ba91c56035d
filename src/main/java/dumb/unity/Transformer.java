package dumb.unity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static dumb.unity.Identity.*;

/**
 * Wraps a base expression in one identity scheme, drawn from the level's scheme weights.
 * High-level composites may be wrapped again, each time with the previous composite as the
 * new base, while the result stays within {@link Level#maxCompositeDepth}.
 */
public class Transformer {

    public static final double DEFAULT_NEST_PROBABILITY = 0.35;

    private static final Map<Level, Map<Identity, Integer>> SCHEMES = new EnumMap<>(Level.class);

    static {
        SCHEMES.put(Level.ELEMENTARY, weights(MULTIPLICATIVE_INVERSE, 3, SHIFTED_INVERSE, 2));
        SCHEMES.put(Level.MIDDLE, weights(MULTIPLICATIVE_INVERSE, 3, SHIFTED_INVERSE, 2,
                EXPONENTIAL_CANCELLATION, 2, ROOT_POWER, 2));
        SCHEMES.put(Level.HIGH, weights(MULTIPLICATIVE_INVERSE, 2, SHIFTED_INVERSE, 1,
                EXPONENTIAL_CANCELLATION, 2, ROOT_POWER, 1, PYTHAGOREAN, 3, LIMIT, 2));
    }

    private final Expr.Var x;
    private final double nestProbability;

    public Transformer() {
        this(Level.X, DEFAULT_NEST_PROBABILITY);
    }

    public Transformer(Expr.Var x, double nestProbability) {
        if (nestProbability < 0 || nestProbability > 1)
            throw new IllegalArgumentException("Nest probability out of [0, 1]: " + nestProbability);
        this.x = x;
        this.nestProbability = nestProbability;
    }

    public Composite compose(Expr base, Level level, Random random) {
        var scheme = choose(level, random);
        var expr = scheme.apply(base, x, random);
        List<Identity> schemes = new ArrayList<>();
        schemes.add(scheme);

        if (level.nests()) {
            while (random.nextDouble() < nestProbability) {
                var next = choose(level, random);
                var wrapped = next.apply(expr, x, random);
                if (wrapped.depth() > level.maxCompositeDepth) break;
                expr = wrapped;
                schemes.add(next);
            }
        }
        return new Composite(expr, List.copyOf(schemes));
    }

    /** Weighted draw from the schemes available at {@code level}. */
    protected Identity choose(Level level, Random random) {
        var table = SCHEMES.get(level);
        var total = table.values().stream().mapToInt(Integer::intValue).sum();
        var r = random.nextInt(total);
        for (var e : table.entrySet()) {
            r -= e.getValue();
            if (r < 0) return e.getKey();
        }
        throw new IllegalStateException("Weighted draw fell through at " + level);
    }

    static Map<Identity, Integer> schemes(Level level) {
        return SCHEMES.get(level);
    }

    private static Map<Identity, Integer> weights(Object... schemeWeightPairs) {
        var m = new EnumMap<Identity, Integer>(Identity.class);
        for (var i = 0; i < schemeWeightPairs.length; i += 2)
            m.put((Identity) schemeWeightPairs[i], (Integer) schemeWeightPairs[i + 1]);
        return m;
    }

    /** A composite expression and the schemes applied to build it, innermost first. */
    public record Composite(Expr expr, List<Identity> schemes) {
        public Identity outermost() {
            return schemes.get(schemes.size() - 1);
        }
    }
}
