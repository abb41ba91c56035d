package dumb.unity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.unity.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pipeline settings. Missing JSON fields take their defaults.
 */
public record Configuration(
        @JsonProperty("retryBudget") int retryBudget,
        @JsonProperty("rewriteIterationCap") int rewriteIterationCap,
        @JsonProperty("historyCap") int historyCap,
        @JsonProperty("guardScope") Guards.Scope guardScope,
        @JsonProperty("maxSessions") int maxSessions,
        @JsonProperty("failLoudly") boolean failLoudly,
        @JsonProperty("nestProbability") double nestProbability,
        @JsonProperty("seed") @Nullable Long seed
) {
    public static final int DEFAULT_RETRY_BUDGET = 20;
    public static final Guards.Scope DEFAULT_GUARD_SCOPE = Guards.Scope.SESSION;
    public static final String RESOURCE = "unity.json";

    public Configuration {
        if (retryBudget < 1) throw new IllegalArgumentException("retryBudget must be positive: " + retryBudget);
        if (rewriteIterationCap < 1)
            throw new IllegalArgumentException("rewriteIterationCap must be positive: " + rewriteIterationCap);
        if (historyCap < 1) throw new IllegalArgumentException("historyCap must be positive: " + historyCap);
        if (guardScope == null) throw new IllegalArgumentException("guardScope is required");
        if (maxSessions < 1) throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        if (!(nestProbability >= 0 && nestProbability <= 1))
            throw new IllegalArgumentException("nestProbability out of [0, 1]: " + nestProbability);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("retryBudget") Integer retryBudget,
            @JsonProperty("rewriteIterationCap") Integer rewriteIterationCap,
            @JsonProperty("historyCap") Integer historyCap,
            @JsonProperty("guardScope") Guards.Scope guardScope,
            @JsonProperty("maxSessions") Integer maxSessions,
            @JsonProperty("failLoudly") Boolean failLoudly,
            @JsonProperty("nestProbability") Double nestProbability,
            @JsonProperty("seed") @Nullable Long seed
    ) {
        this(
                retryBudget != null ? retryBudget : DEFAULT_RETRY_BUDGET,
                rewriteIterationCap != null ? rewriteIterationCap : Simplifier.DEFAULT_ITERATION_CAP,
                historyCap != null ? historyCap : UniquenessGuard.DEFAULT_HISTORY_CAP,
                guardScope != null ? guardScope : DEFAULT_GUARD_SCOPE,
                maxSessions != null ? maxSessions : Guards.DEFAULT_MAX_SESSIONS,
                failLoudly != null && failLoudly,
                nestProbability != null ? nestProbability : Transformer.DEFAULT_NEST_PROBABILITY,
                seed
        );
    }

    public Configuration() {
        this(DEFAULT_RETRY_BUDGET, Simplifier.DEFAULT_ITERATION_CAP, UniquenessGuard.DEFAULT_HISTORY_CAP,
                DEFAULT_GUARD_SCOPE, Guards.DEFAULT_MAX_SESSIONS, false, Transformer.DEFAULT_NEST_PROBABILITY, (Long) null);
    }

    /**
     * Reads {@code file} when given, otherwise the {@value #RESOURCE} classpath resource;
     * defaults when neither exists.
     */
    public static Configuration load(@Nullable Path file) throws IOException {
        if (file != null) {
            if (!Files.exists(file)) throw new IOException("Configuration file not found: " + file);
            return Json.obj(Files.readString(file), Configuration.class);
        }
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                Log.message("No " + RESOURCE + " on the classpath, using defaults");
                return new Configuration();
            }
            return Json.the.readValue(in, Configuration.class);
        }
    }

    public Configuration withRetryBudget(int retryBudget) {
        return new Configuration(retryBudget, rewriteIterationCap, historyCap, guardScope, maxSessions, failLoudly, nestProbability, seed);
    }

    public Configuration withFailLoudly(boolean failLoudly) {
        return new Configuration(retryBudget, rewriteIterationCap, historyCap, guardScope, maxSessions, failLoudly, nestProbability, seed);
    }

    public Configuration withGuardScope(Guards.Scope guardScope) {
        return new Configuration(retryBudget, rewriteIterationCap, historyCap, guardScope, maxSessions, failLoudly, nestProbability, seed);
    }

    public Configuration withMaxSessions(int maxSessions) {
        return new Configuration(retryBudget, rewriteIterationCap, historyCap, guardScope, maxSessions, failLoudly, nestProbability, seed);
    }

    public Configuration withSeed(@Nullable Long seed) {
        return new Configuration(retryBudget, rewriteIterationCap, historyCap, guardScope, maxSessions, failLoudly, nestProbability, seed);
    }
}
