package com.github.dimitryivaniuta.dbgateway.runtime;

/**
 * Notified after a snapshot swap, on the reloading thread.
 */
@FunctionalInterface
public interface RuntimeConfigListener {

    void onReload(RuntimeConfig previous, RuntimeConfig current);
}
