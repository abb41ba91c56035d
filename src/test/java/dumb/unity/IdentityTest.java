package dumb.unity;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityTest extends AbstractTest {

    private static final List<String> BASES = List.of(
            "(+ (^ x 2) 1)",
            "(* 3 (+ (^ x 2) 2))",
            "(+ (exp x) 1)",
            "(+ (^ (sin x) 2) 2)",
            "(^ (+ (* 2 x) 5) 2)",
            "(* 5 (^ (+ (^ x 2) 1) -1))");

    static Stream<Arguments> schemesAndBases() {
        var args = new ArrayList<Arguments>();
        for (var identity : Identity.values())
            for (var base : BASES)
                args.add(Arguments.of(identity, base));
        return args.stream();
    }

    @ParameterizedTest
    @MethodSource("schemesAndBases")
    void everySchemeEqualsOne(Identity identity, String base) {
        for (var seed = 0; seed < 8; seed++) {
            var composite = identity.apply(kif(base), X, seeded(seed));
            assertFalse(composite.is(Expr.Const.ONE));
            assertTrue(composite.depth() > kif(base).depth());
            assertUnity(composite);
        }
    }
}
