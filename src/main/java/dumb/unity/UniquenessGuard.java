package dumb.unity;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fingerprints of the expressions served within one scope. Insertion-ordered and bounded:
 * past {@code historyCap} entries the oldest are evicted. All access holds one lock, so a
 * check-and-record is atomic across concurrent requests sharing the scope.
 */
public class UniquenessGuard {

    public static final int DEFAULT_HISTORY_CAP = 10_000;

    private final LinkedHashSet<String> fingerprints = new LinkedHashSet<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int historyCap;

    public UniquenessGuard() {
        this(DEFAULT_HISTORY_CAP);
    }

    public UniquenessGuard(int historyCap) {
        if (historyCap < 1) throw new IllegalArgumentException("History cap must be positive: " + historyCap);
        this.historyCap = historyCap;
    }

    /** Records {@code fingerprint} and returns true, or returns false when it was already present. */
    public boolean tryRecord(String fingerprint) {
        lock.lock();
        try {
            if (!fingerprints.add(fingerprint)) return false;
            if (fingerprints.size() > historyCap) {
                Iterator<String> oldest = fingerprints.iterator();
                oldest.next();
                oldest.remove();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String fingerprint) {
        lock.lock();
        try {
            return fingerprints.contains(fingerprint);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return fingerprints.size();
        } finally {
            lock.unlock();
        }
    }

    public int historyCap() {
        return historyCap;
    }

    public void clear() {
        lock.lock();
        try {
            fingerprints.clear();
        } finally {
            lock.unlock();
        }
    }
}
