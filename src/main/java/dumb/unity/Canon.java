package dumb.unity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

import static dumb.unity.Expr.Const;
import static dumb.unity.Expr.Nary;

/**
 * Canonical form: nested same-kind sums and products are flattened, their constant operands
 * folded, neutral constants dropped and operands sorted by {@link ExprOrder}. No algebraic
 * identity is applied, so canonicalization distinguishes {@code f * f^-1} from {@code 1}.
 */
public enum Canon {
    ;

    private static final HexFormat HEX = HexFormat.of();

    public static Expr canonical(Expr e) {
        if (e instanceof Const || e instanceof Expr.Var) return e;
        if (e instanceof Nary n) return nary(n);
        if (e instanceof Expr.Pow p) return new Expr.Pow(canonical(p.base()), canonical(p.exponent()));
        if (e instanceof Expr.Fn f)
            return new Expr.Fn(f.func(), f.args().stream().map(Canon::canonical).collect(Collectors.toList()));
        if (e instanceof Expr.Derivative d) return new Expr.Derivative(canonical(d.body()), d.var(), d.order());
        if (e instanceof Expr.Integral i)
            return new Expr.Integral(canonical(i.body()), i.var(),
                    i.lower() == null ? null : canonical(i.lower()),
                    i.upper() == null ? null : canonical(i.upper()));
        if (e instanceof Expr.Limit l) return new Expr.Limit(canonical(l.body()), l.var(), canonical(l.point()));
        throw new IllegalStateException("Unhandled node " + e.getClass().getSimpleName());
    }

    private static Expr nary(Nary n) {
        var add = n.kind == Nary.Kind.ADD;
        var neutral = add ? Const.ZERO : Const.ONE;
        var folded = neutral;
        var constants = 0;
        List<Expr> rest = new ArrayList<>(n.size());
        for (var o : flatten(n.kind, n.operands)) {
            if (o instanceof Const c) {
                folded = add ? folded.plus(c) : folded.times(c);
                constants++;
            } else {
                rest.add(o);
            }
        }
        if (constants > 0 && (!folded.equals(neutral) || rest.isEmpty())) rest.add(folded);
        if (rest.isEmpty()) return neutral;
        if (rest.size() == 1) return rest.get(0);
        rest.sort(ExprOrder.INSTANCE);
        return new Nary(n.kind, rest);
    }

    private static List<Expr> flatten(Nary.Kind kind, List<Expr> operands) {
        var flat = new ArrayList<Expr>(operands.size());
        for (var o : operands) {
            var c = canonical(o);
            if (c instanceof Nary inner && inner.kind == kind) flat.addAll(inner.operands);
            else flat.add(c);
        }
        return flat;
    }

    /** Structural equality: identical canonical forms. */
    public static boolean same(Expr a, Expr b) {
        return canonical(a).equals(canonical(b));
    }

    /** Lowercase hex SHA-256 of the canonical S-expression. */
    public static String fingerprint(Expr e) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(canonical(e).toKif().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException x) {
            throw new IllegalStateException("SHA-256 unavailable", x);
        }
    }
}
