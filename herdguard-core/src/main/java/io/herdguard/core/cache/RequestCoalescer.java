package io.herdguard.core.cache;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single-flight loading: at most one outstanding load per key.
 *
 * <p>The first caller for a key registers an in-flight handle and dispatches the
 * loader on the supplied executor. Callers arriving while that load is in flight
 * attach to the same handle and never invoke the loader themselves.</p>
 *
 * <pre>
 *  caller A ──► putIfAbsent(key) ──► wins ──► executor: loader(key) ──► writeBack ──► complete
 *  caller B ──► putIfAbsent(key) ──► attaches ─────────────────────────────────────────┘
 * </pre>
 *
 * <p>The handle is unregistered before it completes, so a caller arriving after
 * completion starts a new load instead of attaching to a finished one. On
 * success the write-back and the unregistration are a single atomic step with
 * respect to {@link #detach(Object)}: a detached load still completes for the
 * callers already waiting on it, but never writes its value back.</p>
 *
 * <p>No lock is held while the loader runs.</p>
 *
 * @param <K> the type of keys
 * @param <V> the type of loaded values
 *
 * @since 1.0.0
 */
public final class RequestCoalescer<K, V> {

    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final Runnable onCoalesced;

    /**
     * @param onCoalesced invoked each time a caller attaches to an existing load
     */
    public RequestCoalescer(Runnable onCoalesced) {
        this.onCoalesced = Objects.requireNonNull(onCoalesced, "onCoalesced must not be null");
    }

    /**
     * Loads the key, or attaches to the load already in flight for it.
     *
     * <p>Each caller receives its own dependent future: cancelling it does not
     * cancel the shared load other callers are waiting on.</p>
     *
     * @param key the key to load
     * @param loader invoked at most once per in-flight load
     * @param writeBack receives the loaded value before the load completes, unless the load was detached
     * @param executor runs the loader; a direct executor runs it on the calling thread
     * @return a future completed with the loaded value or the loader's failure
     */
    public CompletableFuture<V> load(K key, Function<K, V> loader, Consumer<V> writeBack, Executor executor) {
        CompletableFuture<V> flight = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            onCoalesced.run();
            return existing.copy();
        }

        try {
            executor.execute(() -> run(key, loader, writeBack, flight));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, flight);
            flight.completeExceptionally(e);
        }
        return flight.copy();
    }

    private void run(K key, Function<K, V> loader, Consumer<V> writeBack, CompletableFuture<V> flight) {
        try {
            V value = loader.apply(key);
            inFlight.computeIfPresent(key, (k, current) -> {
                if (current != flight) {
                    // detached: a newer load (or none) owns the key now
                    return current;
                }
                writeBack.accept(value);
                return null;
            });
            flight.complete(value);
        } catch (Throwable t) {
            inFlight.remove(key, flight);
            flight.completeExceptionally(t);
        }
    }

    /**
     * Unregisters the in-flight load for the key, if any.
     * <p>Callers already attached still receive its result.</p>
     *
     * @param key the key
     * @return true if a load was detached
     */
    public boolean detach(K key) {
        return inFlight.remove(key) != null;
    }

    /**
     * Unregisters every in-flight load.
     */
    public void detachAll() {
        inFlight.clear();
    }

    /**
     * Returns true if a load is in flight for the key.
     * @param key the key
     * @return true if loading
     */
    public boolean isLoading(K key) {
        return inFlight.containsKey(key);
    }

    /**
     * Returns the number of loads currently in flight.
     * @return in-flight count
     */
    public int activeCount() {
        return inFlight.size();
    }
}
