package dumb.unity;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/** Asynchronous event bus. Listeners run on the bus executor; a failing listener is logged and skipped. */
public class Events {
    public final ExecutorService exe;
    final ConcurrentMap<Class<? extends UnityEvent>, CopyOnWriteArrayList<Consumer<UnityEvent>>> listeners = new ConcurrentHashMap<>();

    Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<UnityEvent> listener, UnityEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            var message = "Error processing event listener for " + event.getClass().getSimpleName() + ": " + e.getMessage();
            // a failing log listener would receive its own error report again
            if (event instanceof LogMessageEvent) System.err.println("[" + Log.LogLevel.ERROR + "] " + message);
            else Log.error(message);
        }
    }

    public <T extends UnityEvent> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(UnityEvent event) {
        if (exe.isShutdown()) {
            return;
        }
        try {
            exe.submit(() -> listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>())
                    .forEach(listener -> exeSafe(listener, event)));
        } catch (RejectedExecutionException e) {
            Log.warning("Event dropped after shutdown: " + event.getEventType());
        }
    }

    public boolean isOpen() {
        return !exe.isShutdown();
    }

    public void shutdown() {
        exe.shutdown();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogMessageEvent(String message, Log.LogLevel level) implements UnityEvent {
        public LogMessageEvent {
            requireNonNull(message);
            requireNonNull(level);
        }

        @Override
        public String getEventType() {
            return "LogMessageEvent";
        }
    }
}
