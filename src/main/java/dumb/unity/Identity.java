package dumb.unity;

import java.util.Random;

import static dumb.unity.Expr.*;

/**
 * Algebraic schemes that wrap a base expression {@code f} into a tree equal to 1.
 * Each relies only on the guarantees the generator already gives {@code f}: defined, and
 * non-zero where it is inverted.
 */
public enum Identity {

    /** {@code f * f^-1} */
    MULTIPLICATIVE_INVERSE {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            return mul(f, inv(f));
        }
    },

    /** {@code exp(f - f)} */
    EXPONENTIAL_CANCELLATION {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            return fn(Fn.Func.EXP, sub(f, f));
        }
    },

    /** {@code sin(f)^2 + cos(f)^2} */
    PYTHAGOREAN {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            return add(pow(fn(Fn.Func.SIN, f), 2), pow(fn(Fn.Func.COS, f), 2));
        }
    },

    /** {@code sqrt(|f|^n) * sqrt(|f|^n)^-1} for n in 2..6 */
    ROOT_POWER {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            var root = fn(Fn.Func.SQRT, pow(fn(Fn.Func.ABS, f), 2 + random.nextInt(5)));
            return mul(root, inv(root));
        }
    },

    /** {@code (f + 1) * (f + 1)^-1} */
    SHIFTED_INVERSE {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            var shifted = add(f, Const.ONE);
            return mul(shifted, inv(shifted));
        }
    },

    /** {@code lim_{x -> p} g} where {@code g} is an inverse, exponential or Pythagorean composite. */
    LIMIT {
        @Override
        public Expr apply(Expr f, Var x, Random random) {
            var core = LIMIT_CORES[random.nextInt(LIMIT_CORES.length)].apply(f, x, random);
            var point = Generator.LIMIT_POINTS[random.nextInt(Generator.LIMIT_POINTS.length)];
            return new Limit(core, x, num(point));
        }
    };

    private static final Identity[] LIMIT_CORES = {MULTIPLICATIVE_INVERSE, EXPONENTIAL_CANCELLATION, PYTHAGOREAN};

    public abstract Expr apply(Expr f, Var x, Random random);
}
