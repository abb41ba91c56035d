package dumb.unity;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.unity.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTest {

    @Test
    void defaults() {
        var c = new Configuration();
        assertEquals(20, c.retryBudget());
        assertEquals(64, c.rewriteIterationCap());
        assertEquals(10_000, c.historyCap());
        assertEquals(Guards.Scope.SESSION, c.guardScope());
        assertEquals(1_000, c.maxSessions());
        assertFalse(c.failLoudly());
        assertEquals(0.35, c.nestProbability());
        assertNull(c.seed());
    }

    @Test
    void missingFieldsTakeDefaults() throws JsonProcessingException {
        var c = Json.obj("{\"retryBudget\": 5, \"guardScope\": \"PROCESS\", \"seed\": 9}", Configuration.class);
        assertEquals(5, c.retryBudget());
        assertEquals(Guards.Scope.PROCESS, c.guardScope());
        assertEquals(9L, c.seed());
        assertEquals(64, c.rewriteIterationCap());
        assertFalse(c.failLoudly());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"retryBudget\": 0}", Configuration.class));
        assertThrows(IllegalArgumentException.class, () -> new Configuration().withRetryBudget(-1));
        assertThrows(IllegalArgumentException.class, () -> new Configuration().withMaxSessions(0));
    }

    @Test
    void jsonReadsBack() throws JsonProcessingException {
        var c = new Configuration().withFailLoudly(true).withSeed(7L).withGuardScope(Guards.Scope.PROCESS);
        assertEquals(c, Json.obj(Json.str(c), Configuration.class));
    }

    @Test
    void loadsClasspathResourceByDefault() throws IOException {
        assertEquals(new Configuration(), Configuration.load(null));
    }

    @Test
    void loadsFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("unity.json");
        Files.writeString(file, "{\"failLoudly\": true, \"historyCap\": 50}");
        var c = Configuration.load(file);
        assertTrue(c.failLoudly());
        assertEquals(50, c.historyCap());
        assertEquals(1_000, c.maxSessions());
        assertThrows(IOException.class, () -> Configuration.load(dir.resolve("missing.json")));
    }
}
