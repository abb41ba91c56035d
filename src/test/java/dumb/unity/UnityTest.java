package dumb.unity;

import dumb.unity.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class UnityTest extends AbstractTest {

    private Unity unity;

    @AfterEach
    void tearDown() {
        if (unity != null) unity.close();
    }

    private static Pipeline rejecting(Configuration config, Events events) {
        var validator = new Validator() {
            @Override
            public Verdict validate(Expr e) {
                return new Verdict(false, e, 0, "forced");
            }
        };
        return new Pipeline(new Generator(), new Transformer(), validator, 1, config.failLoudly(), events);
    }

    @Test
    void generatesAResponse() {
        unity = new Unity();
        var r = unity.generate("2", "s1");
        assertEquals(2, r.level());
        assertFalse(r.fallback());
        assertEquals(64, r.fingerprint().length());
        assertFalse(r.latex().isEmpty());
        assertNotEquals("1", r.expr());
        assertTrue(r.attempts() >= 1);
        assertNotNull(r.generatedAt());
    }

    @Test
    void missingLevelIsElementary() {
        unity = new Unity();
        assertEquals(1, unity.generate((String) null, null).level());
        assertEquals(1, unity.generate("nonsense", null).level());
        assertEquals(3, unity.generate("High", null).level());
    }

    @Test
    void sessionNeverSeesARepeat() {
        unity = new Unity(new Configuration().withSeed(1L));
        var seen = new HashSet<String>();
        for (var i = 0; i < 25; i++) {
            var r = unity.generate(Level.ELEMENTARY, "s");
            if (!r.fallback()) assertTrue(seen.add(r.fingerprint()), r.expr());
        }
        assertTrue(unity.endSession("s"));
    }

    @Test
    void seededInstancesAreReproducible() {
        unity = new Unity(new Configuration().withSeed(5L));
        try (var other = new Unity(new Configuration().withSeed(5L))) {
            assertEquals(unity.generate("3", "a").expr(), other.generate("3", "a").expr());
        }
    }

    @Test
    void asyncGeneration() throws Exception {
        unity = new Unity();
        var r = unity.generateAsync("3", null).get(30, TimeUnit.SECONDS);
        assertEquals(3, r.level());
    }

    @Test
    void fallbackIsServedAfterTheBudget() {
        unity = new Unity(new Configuration()) {
            @Override
            protected Pipeline pipeline(Configuration config, Events events) {
                return rejecting(config, events);
            }
        };
        var r = unity.generate("2", null);
        assertTrue(r.fallback());
        assertEquals(Fallbacks.of(Level.MIDDLE).toString(), r.expr());
        assertEquals(1, r.attempts());
    }

    @Test
    void exhaustionSurfacesWhenFailingLoudly() {
        unity = new Unity(new Configuration().withFailLoudly(true)) {
            @Override
            protected Pipeline pipeline(Configuration config, Events events) {
                return rejecting(config, events);
            }
        };
        assertThrows(PipelineExhaustedException.class, () -> unity.generate("1", null));
    }

    @Test
    void responseSerializesOnOneLine() {
        unity = new Unity();
        var r = unity.generate("1", null);
        var line = Json.line(r);
        assertFalse(line.contains("\n"));
        assertTrue(line.contains("\"level\":1"), line);
        assertTrue(line.contains("\"generatedAt\":\"" + r.generatedAt()), line);
    }
}
