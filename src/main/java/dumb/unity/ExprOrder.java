package dumb.unity;

import java.util.Comparator;
import java.util.List;

/**
 * Total order over expressions: first by node kind, then field by field.
 * Commutative operands are sorted with it, so equal trees always serialize identically.
 */
public enum ExprOrder implements Comparator<Expr> {
    INSTANCE;

    static int rank(Expr e) {
        if (e instanceof Expr.Const) return 0;
        if (e instanceof Expr.Var) return 1;
        if (e instanceof Expr.Pow) return 2;
        if (e instanceof Expr.Nary n) return n.kind == Expr.Nary.Kind.MUL ? 3 : 4;
        if (e instanceof Expr.Fn) return 5;
        if (e instanceof Expr.Derivative) return 6;
        if (e instanceof Expr.Integral) return 7;
        if (e instanceof Expr.Limit) return 8;
        throw new IllegalStateException("Unhandled node " + e.getClass().getSimpleName());
    }

    @Override
    public int compare(Expr a, Expr b) {
        if (a == b) return 0;
        var c = Integer.compare(rank(a), rank(b));
        if (c != 0) return c;

        if (a instanceof Expr.Const ca)
            return ca.compareTo((Expr.Const) b);
        if (a instanceof Expr.Var va)
            return va.name().compareTo(((Expr.Var) b).name());
        if (a instanceof Expr.Pow pa) {
            var pb = (Expr.Pow) b;
            c = compare(pa.base(), pb.base());
            return c != 0 ? c : compare(pa.exponent(), pb.exponent());
        }
        if (a instanceof Expr.Nary na)
            return compareLists(na.operands, ((Expr.Nary) b).operands);
        if (a instanceof Expr.Fn fa) {
            var fb = (Expr.Fn) b;
            c = fa.func().compareTo(fb.func());
            return c != 0 ? c : compareLists(fa.args(), fb.args());
        }
        if (a instanceof Expr.Derivative da) {
            var db = (Expr.Derivative) b;
            c = da.var().name().compareTo(db.var().name());
            if (c == 0) c = Integer.compare(da.order(), db.order());
            return c != 0 ? c : compare(da.body(), db.body());
        }
        if (a instanceof Expr.Integral ia) {
            var ib = (Expr.Integral) b;
            c = ia.var().name().compareTo(ib.var().name());
            if (c == 0) c = Boolean.compare(ia.definite(), ib.definite());
            return c != 0 ? c : compareLists(ia.children(), ib.children());
        }
        var la = (Expr.Limit) a;
        var lb = (Expr.Limit) b;
        c = la.var().name().compareTo(lb.var().name());
        return c != 0 ? c : compareLists(la.children(), lb.children());
    }

    private int compareLists(List<Expr> x, List<Expr> y) {
        var n = Math.min(x.size(), y.size());
        for (var i = 0; i < n; i++) {
            var c = compare(x.get(i), y.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(x.size(), y.size());
    }
}
