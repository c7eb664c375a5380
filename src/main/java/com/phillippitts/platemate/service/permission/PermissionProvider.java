package com.phillippitts.platemate.service.permission;

import java.util.function.Consumer;

/**
 * Grants or refuses access to a guarded resource.
 *
 * <p>Implementations notify listeners on every status transition, including the one caused by
 * {@link #requestPermission()}.
 */
public interface PermissionProvider {

    /**
     * Asks for access. Idempotent: once decided, returns the decided status without prompting again.
     *
     * @return status after the request
     */
    PermissionStatus requestPermission();

    PermissionStatus currentStatus();

    void addListener(Consumer<PermissionStatus> listener);
}
