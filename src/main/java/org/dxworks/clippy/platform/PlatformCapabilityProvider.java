package org.dxworks.clippy.platform;

import java.util.Optional;

/**
 * Source of platform capability records. Lookups for unknown platforms resolve to the
 * provider's fallback record.
 */
public interface PlatformCapabilityProvider {

    Optional<PlatformCapabilities> find(String platformId);

    PlatformCapabilities fallback();

    default PlatformCapabilities capabilitiesFor(String platformId) {
        return find(platformId).orElseGet(this::fallback);
    }
}
