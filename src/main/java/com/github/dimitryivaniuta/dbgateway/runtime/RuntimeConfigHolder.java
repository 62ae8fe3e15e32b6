package com.github.dimitryivaniuta.dbgateway.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the single active {@link RuntimeConfig}.
 *
 * <p>{@link #read()} is one volatile read and never waits for a reload. Callers read once
 * per request and keep the returned snapshot; a concurrent reload only affects later reads.
 * Reloads are serialized among themselves and swap the whole snapshot in one step.
 */
@Slf4j
public final class RuntimeConfigHolder {

    private final AtomicReference<RuntimeConfig> current;
    private final Object reloadLock = new Object();
    private final List<RuntimeConfigListener> listeners = new CopyOnWriteArrayList<>();

    public RuntimeConfigHolder(RuntimeConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial config must not be null"));
    }

    public RuntimeConfig read() {
        return current.get();
    }

    public void addListener(RuntimeConfigListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public ReloadResult reload(RuntimeConfig candidate, ReloadTrigger trigger) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        return reload(() -> candidate, trigger);
    }

    /**
     * Builds the candidate and swaps it in. A supplier that throws (malformed or invalid
     * configuration) yields a failure result and leaves the active snapshot in force.
     */
    public ReloadResult reload(Supplier<RuntimeConfig> candidate, ReloadTrigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");

        synchronized (reloadLock) {
            RuntimeConfig next;
            try {
                next = candidate.get();
            } catch (RuntimeException ex) {
                String reason = (ex.getMessage() == null) ? ex.getClass().getSimpleName() : ex.getMessage();
                log.warn("Runtime config reload rejected trigger=\"{}\" reason={}", trigger, reason);
                return ReloadResult.failure(reason, trigger);
            }
            if (next == null) {
                log.warn("Runtime config reload rejected trigger=\"{}\" reason=no configuration", trigger);
                return ReloadResult.failure("no configuration", trigger);
            }

            RuntimeConfig previous = current.getAndSet(next);
            List<String> changed = next.diff(previous);
            if (changed.isEmpty()) {
                log.info("Runtime config reloaded trigger=\"{}\" changed=none", trigger);
            } else {
                log.info("Runtime config reloaded trigger=\"{}\" changed={}", trigger, changed);
                // under the lock so listeners see reloads in swap order
                notifyListeners(previous, next);
            }
            return ReloadResult.success(changed, trigger);
        }
    }

    private void notifyListeners(RuntimeConfig previous, RuntimeConfig next) {
        for (RuntimeConfigListener l : listeners) {
            try {
                l.onReload(previous, next);
            } catch (RuntimeException ex) {
                log.warn("Runtime config listener failed listener={} reason={}", l.getClass().getName(), ex.toString());
            }
        }
    }
}
