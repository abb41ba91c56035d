package dumb.unity;

/**
 * An operation would be undefined over the reals (zero denominator, logarithm of zero).
 * Raised while rewriting; the validator turns it into a reject.
 */
public class DomainGuardViolation extends ArithmeticException {

    public DomainGuardViolation(String message) {
        super(message);
    }
}
