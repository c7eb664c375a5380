package com.phillippitts.platemate.service.permission;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listener bookkeeping shared by permission providers. Subclasses decide the answer once.
 */
abstract class AbstractPermissionProvider implements PermissionProvider {

    private static final Logger LOG = LogManager.getLogger(AbstractPermissionProvider.class);

    private final List<Consumer<PermissionStatus>> listeners = new CopyOnWriteArrayList<>();
    private volatile PermissionStatus status = PermissionStatus.NOT_DETERMINED;

    @Override
    public synchronized PermissionStatus requestPermission() {
        if (status == PermissionStatus.NOT_DETERMINED) {
            transitionTo(decide());
        }
        return status;
    }

    @Override
    public PermissionStatus currentStatus() {
        return status;
    }

    @Override
    public void addListener(Consumer<PermissionStatus> listener) {
        listeners.add(listener);
    }

    /** Computes the answer for the first request. */
    protected abstract PermissionStatus decide();

    protected abstract String resourceName();

    private void transitionTo(PermissionStatus next) {
        if (next == status) {
            return;
        }
        LOG.info("{} permission: {} -> {}", resourceName(), status, next);
        status = next;
        for (Consumer<PermissionStatus> l : listeners) {
            try {
                l.accept(next);
            } catch (RuntimeException e) {
                LOG.warn("{} permission listener failed: {}", resourceName(), e.getMessage(), e);
            }
        }
    }
}
