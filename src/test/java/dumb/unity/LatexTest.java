package dumb.unity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LatexTest extends AbstractTest {

    private static String latex(String text) {
        return Latex.render(kif(text));
    }

    @Test
    void reciprocalsBecomeFractions() {
        assertEquals("\\frac{x^{2} + 1}{x^{2} + 1}", latex("(* (+ (^ x 2) 1) (^ (+ (^ x 2) 1) -1))"));
        assertEquals("\\frac{1}{x}", latex("(^ x -1)"));
        assertEquals("\\frac{3}{4}", latex("3/4"));
    }

    @Test
    void functionsAndRadicals() {
        assertEquals("\\sin^{2}\\left(x\\right) + \\cos^{2}\\left(x\\right)", latex("(+ (^ (sin x) 2) (^ (cos x) 2))"));
        assertEquals("\\sqrt{x}", latex("(sqrt x)"));
        assertEquals("\\sqrt[3]{x}", latex("(^ x 1/3)"));
        assertEquals("\\left|x\\right|", latex("(abs x)"));
        assertEquals("e^{x - x}", latex("(exp (+ x (* -1 x)))"));
    }

    @Test
    void calculusNotation() {
        assertEquals("\\frac{d}{dx}\\left(x^{2}\\right)", latex("(d (^ x 2) x 1)"));
        assertEquals("\\int_{0}^{1} x \\, dx", latex("(int x x 0 1)"));
        assertEquals("\\lim_{x \\to 0} \\left(x + 1\\right)", latex("(lim (+ x 1) x 0)"));
    }
}
