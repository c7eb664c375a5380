package com.phillippitts.platemate.service.permission;

import com.phillippitts.platemate.config.properties.LocationProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Location permission answered from configuration ({@code location.permission-granted}).
 * A server process has no interactive prompt, so the operator decides up front.
 */
@Component
@Qualifier("locationPermission")
public class ConfiguredLocationPermissionProvider extends AbstractPermissionProvider {

    private final boolean granted;

    public ConfiguredLocationPermissionProvider(LocationProperties properties) {
        this.granted = properties.isPermissionGranted();
    }

    @Override
    protected PermissionStatus decide() {
        return granted ? PermissionStatus.AUTHORIZED_WHEN_IN_USE : PermissionStatus.DENIED;
    }

    @Override
    protected String resourceName() {
        return "location";
    }
}
