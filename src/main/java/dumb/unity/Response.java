package dumb.unity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * What a caller receives for one request.
 *
 * @param expr     infix text of the served expression
 * @param latex    the same expression as LaTeX
 * @param level    1, 2 or 3
 * @param attempts pipeline attempts spent on the request
 * @param fallback true when the level's fixed fallback was served
 */
public record Response(
        @JsonProperty("expr") String expr,
        @JsonProperty("latex") String latex,
        @JsonProperty("level") int level,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("fallback") boolean fallback,
        @JsonProperty("generatedAt") Instant generatedAt
) {
    static Response of(Expr e, Level level, int attempts, boolean fallback) {
        return new Response(e.toString(), Latex.render(e), level.number, Canon.fingerprint(e), attempts, fallback, Instant.now());
    }
}
