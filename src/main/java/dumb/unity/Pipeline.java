package dumb.unity;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static java.util.Objects.requireNonNull;

/**
 * Generate, compose, validate and check uniqueness, retried up to the retry budget.
 * <p>
 * An attempt touches shared state only through {@link UniquenessGuard#tryRecord}, and only
 * after its composite validated, so a request abandoned between attempts leaves nothing behind.
 * When the budget runs out the level's fallback is served, or {@link Outcome.Exhausted} is
 * returned when failing loudly.
 */
public class Pipeline {

    private final Generator generator;
    private final Transformer transformer;
    private final Validator validator;
    private final int retryBudget;
    private final boolean failLoudly;
    private final @Nullable Events events;

    public Pipeline(Configuration config, @Nullable Events events) {
        this(new Generator(), new Transformer(Level.X, config.nestProbability()),
                new Validator(new Simplifier(config.rewriteIterationCap())),
                config.retryBudget(), config.failLoudly(), events);
    }

    public Pipeline(Generator generator, Transformer transformer, Validator validator,
                    int retryBudget, boolean failLoudly, @Nullable Events events) {
        if (retryBudget < 1) throw new IllegalArgumentException("Retry budget must be positive: " + retryBudget);
        this.generator = requireNonNull(generator);
        this.transformer = requireNonNull(transformer);
        this.validator = requireNonNull(validator);
        this.retryBudget = retryBudget;
        this.failLoudly = failLoudly;
        this.events = events;
    }

    /**
     * @throws CancellationException when the calling thread is interrupted between attempts
     */
    public Outcome run(Level level, UniquenessGuard guard, Random random) {
        for (var n = 1; n <= retryBudget; n++) {
            if (Thread.currentThread().isInterrupted())
                throw new CancellationException("Request abandoned before attempt " + n + " at " + level);

            var attempt = attempt(level, guard, random);
            if (attempt instanceof Attempt.Accept a) {
                emit(new ExpressionAcceptedEvent(level, a.composite().expr().toKif(), a.fingerprint(), n));
                return new Outcome.Accepted(a.composite().expr(), a.base(), a.composite().schemes(), a.fingerprint(), n);
            }
            var r = (Attempt.Reject) attempt;
            emit(new AttemptRejectedEvent(level, n, r.reason(), r.detail()));
        }

        if (failLoudly) {
            Log.error("Pipeline exhausted at " + level + " after " + retryBudget + " attempts");
            emit(new PipelineExhaustedEvent(level, retryBudget));
            return new Outcome.Exhausted(retryBudget);
        }
        Log.warning("Retry budget spent at " + level + ", serving fallback");
        emit(new FallbackServedEvent(level, retryBudget));
        return new Outcome.Fallback(Fallbacks.of(level), retryBudget);
    }

    /**
     * Same as {@link #run}, with {@link Outcome.Exhausted} raised.
     *
     * @throws PipelineExhaustedException when failing loudly and the retry budget is spent
     */
    public Outcome generate(Level level, UniquenessGuard guard, Random random) {
        var outcome = run(level, guard, random);
        if (outcome instanceof Outcome.Exhausted x) throw new PipelineExhaustedException(level, x.attempts());
        return outcome;
    }

    /** One full generate, transform, validate and uniqueness check. */
    public Attempt attempt(Level level, UniquenessGuard guard, Random random) {
        var base = generator.generate(level, random);
        var composite = transformer.compose(base, level, random);
        var verdict = validator.validate(composite.expr());
        if (!verdict.accepted())
            return new Attempt.Reject(Reason.VALIDATION, verdict.reason() == null ? "rejected" : verdict.reason());
        var fingerprint = Canon.fingerprint(composite.expr());
        if (!guard.tryRecord(fingerprint))
            return new Attempt.Reject(Reason.UNIQUENESS, "Duplicate fingerprint " + fingerprint);
        return new Attempt.Accept(composite, base, fingerprint);
    }

    public int retryBudget() {
        return retryBudget;
    }

    public boolean failLoudly() {
        return failLoudly;
    }

    private void emit(UnityEvent e) {
        if (events != null) events.emit(e);
    }

    public enum Reason {
        VALIDATION, UNIQUENESS
    }

    public sealed interface Attempt permits Attempt.Accept, Attempt.Reject {
        record Accept(Transformer.Composite composite, Expr base, String fingerprint) implements Attempt {
        }

        record Reject(Reason reason, String detail) implements Attempt {
        }
    }

    public sealed interface Outcome permits Outcome.Accepted, Outcome.Fallback, Outcome.Exhausted {
        int attempts();

        record Accepted(Expr composite, Expr base, List<Identity> schemes, String fingerprint,
                        int attempts) implements Outcome {
        }

        record Fallback(Expr composite, int attempts) implements Outcome {
        }

        record Exhausted(int attempts) implements Outcome {
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AttemptRejectedEvent(Level level, int attempt, Reason reason, String detail) implements UnityEvent {
        @Override
        public String getEventType() {
            return "AttemptRejectedEvent";
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ExpressionAcceptedEvent(Level level, String expr, String fingerprint, int attempts) implements UnityEvent {
        @Override
        public String getEventType() {
            return "ExpressionAcceptedEvent";
        }
    }

    public record FallbackServedEvent(Level level, int attempts) implements UnityEvent {
        @Override
        public String getEventType() {
            return "FallbackServedEvent";
        }
    }

    public record PipelineExhaustedEvent(Level level, int attempts) implements UnityEvent {
        @Override
        public String getEventType() {
            return "PipelineExhaustedEvent";
        }
    }
}
