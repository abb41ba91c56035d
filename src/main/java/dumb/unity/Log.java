package dumb.unity;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public class Log {

    private static volatile @Nullable Events events;

    public static void setEvents(Events events) {
        Log.events = requireNonNull(events);
    }

    /** Detaches {@code events} if it is the installed bus. */
    public static void unsetEvents(Events events) {
        if (Log.events == events) Log.events = null;
    }

    public static void message(String message) {
        message(message, LogLevel.INFO);
    }

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void message(String message, LogLevel level) {
        var e = events;
        if (e != null && e.isOpen()) {
            e.emit(new Events.LogMessageEvent(message, level));
        } else {
            System.out.println("[" + level + "] " + message);
        }
    }

    public enum LogLevel {
        INFO, WARNING, ERROR
    }
}
