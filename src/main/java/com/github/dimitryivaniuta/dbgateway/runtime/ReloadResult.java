package com.github.dimitryivaniuta.dbgateway.runtime;

import java.util.List;

/**
 * Outcome of one reload attempt, reported back to the trigger source.
 *
 * @param changed {@code "field: old -> new"} entries, empty on failure or when nothing changed
 */
public record ReloadResult(boolean success, String error, List<String> changed, String trigger) {

    public ReloadResult {
        changed = (changed == null) ? List.of() : List.copyOf(changed);
    }

    public static ReloadResult success(List<String> changed, ReloadTrigger trigger) {
        return new ReloadResult(true, null, changed, trigger.toString());
    }

    public static ReloadResult failure(String error, ReloadTrigger trigger) {
        return new ReloadResult(false, error, List.of(), trigger.toString());
    }
}
