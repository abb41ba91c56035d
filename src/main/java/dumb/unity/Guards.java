package dumb.unity;

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Resolves the {@link UniquenessGuard} a request is checked against. At most {@code maxSessions}
 * sessions are kept; past that the least recently used one is forgotten.
 */
public class Guards {

    public static final int DEFAULT_MAX_SESSIONS = 1_000;

    static final String ANONYMOUS = "";

    private final Scope scope;
    private final int historyCap;
    private final int maxSessions;
    private final UniquenessGuard process;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, UniquenessGuard> sessions;

    public Guards(Scope scope, int historyCap) {
        this(scope, historyCap, DEFAULT_MAX_SESSIONS);
    }

    public Guards(Scope scope, int historyCap, int maxSessions) {
        if (maxSessions < 1) throw new IllegalArgumentException("Session cap must be positive: " + maxSessions);
        this.scope = requireNonNull(scope);
        this.historyCap = historyCap;
        this.maxSessions = maxSessions;
        this.process = new UniquenessGuard(historyCap);
        this.sessions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, UniquenessGuard> eldest) {
                if (size() <= Guards.this.maxSessions) return false;
                Log.message("Session cap " + Guards.this.maxSessions + " reached, forgetting session '" + eldest.getKey() + "'");
                return true;
            }
        };
    }

    /** Blank session ids share one anonymous session. Under {@link Scope#PROCESS} the id is ignored. */
    public UniquenessGuard forSession(@Nullable String sessionId) {
        if (scope == Scope.PROCESS) return process;
        var key = key(sessionId);
        lock.lock();
        try {
            return sessions.computeIfAbsent(key, k -> new UniquenessGuard(historyCap));
        } finally {
            lock.unlock();
        }
    }

    /** Drops a session's history. Returns false when the session was unknown or the scope is process-wide. */
    public boolean end(@Nullable String sessionId) {
        if (scope == Scope.PROCESS) return false;
        var key = key(sessionId);
        lock.lock();
        try {
            return sessions.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public Scope scope() {
        return scope;
    }

    public int maxSessions() {
        return maxSessions;
    }

    public int sessionCount() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    private static String key(@Nullable String sessionId) {
        return sessionId == null || sessionId.isBlank() ? ANONYMOUS : sessionId.trim();
    }

    public enum Scope {
        SESSION, PROCESS
    }
}
