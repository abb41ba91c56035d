package dumb.unity;

import java.util.EnumMap;
import java.util.Map;

/** Fixed known-good composites served when a request's retry budget runs out. */
public enum Fallbacks {
    ;

    static final Map<Level, String> TEXT = Map.of(
            Level.ELEMENTARY, "(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))",
            Level.MIDDLE, "(* (sqrt (^ (abs (+ (^ x 2) (* 3 x) 5)) 4)) (^ (sqrt (^ (abs (+ (^ x 2) (* 3 x) 5)) 4)) -1))",
            Level.HIGH, "(+ (^ (sin (d (^ x 2) x 1)) 2) (^ (cos (d (^ x 2) x 1)) 2))");

    private static final Map<Level, Expr> PARSED = new EnumMap<>(Level.class);

    static {
        for (var e : TEXT.entrySet()) {
            try {
                PARSED.put(e.getKey(), ExprParser.parse(e.getValue()));
            } catch (ExprParser.ParseException ex) {
                throw new IllegalStateException("Malformed fallback for " + e.getKey() + ": " + ex.getMessage(), ex);
            }
        }
    }

    public static Expr of(Level level) {
        return PARSED.get(level);
    }
}
