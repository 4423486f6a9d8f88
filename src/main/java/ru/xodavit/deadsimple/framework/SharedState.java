package ru.xodavit.deadsimple.framework;

import lombok.extern.java.Log;
import ru.xodavit.deadsimple.framework.exception.PoisonedStateException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The single application value shared by all concurrently running handlers.
 * <p>
 * The value is reachable only inside {@link #withLock(Function)} or {@link #update(Consumer)}, while
 * the caller exclusively holds the lock. If the callback throws, the container is poisoned and every
 * later acquisition fails with {@link PoisonedStateException}.
 *
 * @param <T> type of the application value
 */
@Log
public final class SharedState<T> {
    private final ReentrantLock lock = new ReentrantLock();
    private final T value;
    // guarded by lock
    private Throwable poisonedBy;

    public SharedState(T initialValue) {
        this.value = initialValue;
    }

    public <R> R withLock(Function<? super T, ? extends R> action) {
        lock.lock();
        try {
            if (poisonedBy != null) {
                throw new PoisonedStateException("shared state is poisoned by an earlier failure", poisonedBy);
            }
            try {
                return action.apply(value);
            } catch (RuntimeException | Error e) {
                poisonedBy = e;
                log.severe("shared state poisoned: " + e);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    public void update(Consumer<? super T> action) {
        withLock(v -> {
            action.accept(v);
            return null;
        });
    }

    public boolean isPoisoned() {
        lock.lock();
        try {
            return poisonedBy != null;
        } finally {
            lock.unlock();
        }
    }
}
