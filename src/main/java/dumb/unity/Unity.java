package dumb.unity;

import dumb.unity.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static dumb.unity.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Entry point for callers: resolves the level and the session's uniqueness guard, runs the
 * pipeline and packages the result. Also a command line generator.
 */
public class Unity implements AutoCloseable {

    public final Configuration config;
    public final Events events;
    final Guards guards;
    final Pipeline pipeline;

    private final ExecutorService exe;
    private final AtomicLong requests = new AtomicLong();
    private final SecureRandom entropy = new SecureRandom();

    public Unity() {
        this(new Configuration());
    }

    public Unity(Configuration config) {
        this.config = requireNonNull(config);
        this.exe = Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
        this.events = new Events(exe);
        // stdout carries responses
        events.on(Events.LogMessageEvent.class, e -> System.err.println("[" + e.level() + "] " + e.message()));
        Log.setEvents(events);
        this.guards = new Guards(config.guardScope(), config.historyCap(), config.maxSessions());
        this.pipeline = pipeline(config, events);
    }

    /** The pipeline this instance runs. */
    protected Pipeline pipeline(Configuration config, Events events) {
        return new Pipeline(config, events);
    }

    public static void main(String[] args) {
        String levelText = null, session = null;
        Path configFile = null;
        Long seed = null;
        var count = 1;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-l", "--level" -> levelText = args[++i];
                    case "-n", "--count" -> count = Integer.parseInt(args[++i]);
                    case "-s", "--session" -> session = args[++i];
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    case "--seed" -> seed = Long.parseLong(args[++i]);
                    case "-h", "--help" -> printUsageAndExit(0);
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", (i > 0 ? args[i - 1] : args[i]), e.getMessage()));
                printUsageAndExit(1);
            }
        }

        Configuration config;
        try {
            config = Configuration.load(configFile);
        } catch (IOException | IllegalArgumentException e) {
            error("Configuration failed: " + e.getMessage());
            System.exit(1);
            return;
        }
        if (seed != null) config = config.withSeed(seed);

        try (var u = new Unity(config)) {
            for (var i = 0; i < count; i++)
                System.out.println(Json.line(u.generate(levelText, session)));
        } catch (PipelineExhaustedException e) {
            error(e.getMessage());
            System.exit(2);
        }
    }

    private static void printUsageAndExit(int status) {
        System.err.printf("Usage: java %s [-l 1|2|3] [-n count] [-s session] [-c config.json] [--seed n]%n", Unity.class.getName());
        System.exit(status);
    }

    /**
     * @param levelText {@code 1|2|3} or a level name; anything else is {@link Level#ELEMENTARY}
     * @param sessionId session whose history the result must be new to; null or blank for the anonymous session
     * @throws PipelineExhaustedException when failing loudly and no expression was accepted
     */
    public Response generate(@Nullable String levelText, @Nullable String sessionId) {
        return generate(Level.parse(levelText), sessionId);
    }

    public Response generate(Level level, @Nullable String sessionId) {
        var outcome = pipeline.generate(level, guards.forSession(sessionId), random());
        if (outcome instanceof Pipeline.Outcome.Accepted a)
            return Response.of(a.composite(), level, a.attempts(), false);
        if (outcome instanceof Pipeline.Outcome.Fallback f)
            return Response.of(f.composite(), level, f.attempts(), true);
        throw new IllegalStateException("Unexpected outcome " + outcome);
    }

    public CompletableFuture<Response> generateAsync(@Nullable String levelText, @Nullable String sessionId) {
        return CompletableFuture.supplyAsync(() -> generate(levelText, sessionId), exe);
    }

    /** Forgets a session's served expressions. */
    public boolean endSession(@Nullable String sessionId) {
        return guards.end(sessionId);
    }

    /** A configured seed makes the n-th request reproducible; otherwise each request draws fresh entropy. */
    Random random() {
        var n = requests.getAndIncrement();
        return config.seed() != null ? new Random(config.seed() + n) : new Random(entropy.nextLong());
    }

    @Override
    public void close() {
        Log.unsetEvents(events);
        events.shutdown();
        try {
            if (!exe.awaitTermination(5, TimeUnit.SECONDS)) exe.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exe.shutdownNow();
        }
    }
}
