package dumb.unity;

/** The retry budget ran out with no accepted expression and the pipeline is set to fail loudly. */
public class PipelineExhaustedException extends RuntimeException {

    private final Level level;
    private final int attempts;

    public PipelineExhaustedException(Level level, int attempts) {
        super("No expression accepted at " + level + " after " + attempts + " attempts, retry later");
        this.level = level;
        this.attempts = attempts;
    }

    public Level level() {
        return level;
    }

    public int attempts() {
        return attempts;
    }
}
