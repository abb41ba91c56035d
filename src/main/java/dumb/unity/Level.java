package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static dumb.unity.Generator.Kind.*;

/** Difficulty tiers. Each carries its generation budget and node-kind weight table. */
public enum Level {
    ELEMENTARY(1, 3, 4, 10, weights(
            CONST, 2, VAR, 3, ADD, 3, SUB, 2, MUL, 3, POW, 2)),
    MIDDLE(2, 5, 6, 14, weights(
            CONST, 2, VAR, 3, ADD, 3, SUB, 2, MUL, 3, POW, 2,
            DIV, 2, SQRT, 1, ROOT, 1, POLY, 3, ABS, 1)),
    HIGH(3, 7, 8, 20, weights(
            CONST, 2, VAR, 3, ADD, 3, SUB, 2, MUL, 3, POW, 2,
            DIV, 1, SQRT, 1, ROOT, 1, POLY, 2, ABS, 1,
            SIN, 2, COS, 2, EXP, 1, LOG, 1, DERIVATIVE, 2, INTEGRAL, 1, LIMIT, 1));

    public static final Expr.Var X = Expr.Var.of("x");

    public final int number;
    /** Depth budget of the raw tree, before the final non-zero guard. */
    public final int maxDepth;
    public final int minNodes;
    /** Depth a nested identity may grow the composite to. */
    public final int maxCompositeDepth;
    public final Map<Generator.Kind, Integer> weights;

    Level(int number, int maxDepth, int minNodes, int maxCompositeDepth, Map<Generator.Kind, Integer> weights) {
        this.number = number;
        this.maxDepth = maxDepth;
        this.minNodes = minNodes;
        this.maxCompositeDepth = maxCompositeDepth;
        this.weights = Collections.unmodifiableMap(weights);
    }

    /**
     * Maps a level selector ({@code 1|2|3} or a tier name, case-insensitive) to a level.
     * Missing and unrecognized selectors select {@link #ELEMENTARY}.
     */
    public static Level parse(@Nullable String selector) {
        if (selector == null) return ELEMENTARY;
        var s = selector.trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "2", "middle" -> MIDDLE;
            case "3", "high" -> HIGH;
            default -> ELEMENTARY;
        };
    }

    public static Level of(int number) {
        for (var l : values())
            if (l.number == number) return l;
        return ELEMENTARY;
    }

    /** Largest depth a guarded base expression can have. */
    public int maxBaseDepth() {
        return maxDepth + Domain.GUARD_DEPTH;
    }

    public boolean nests() {
        return this == HIGH;
    }

    private static Map<Generator.Kind, Integer> weights(Object... kindWeightPairs) {
        var m = new EnumMap<Generator.Kind, Integer>(Generator.Kind.class);
        for (var i = 0; i < kindWeightPairs.length; i += 2)
            m.put((Generator.Kind) kindWeightPairs[i], (Integer) kindWeightPairs[i + 1]);
        return m;
    }
}
