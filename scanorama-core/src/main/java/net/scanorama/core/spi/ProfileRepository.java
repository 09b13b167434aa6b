package net.scanorama.core.spi;

import net.scanorama.core.model.ScanProfile;

import java.util.Optional;

public interface ProfileRepository {
    Optional<ScanProfile> findById(String id) throws Exception;

    /** Global fallback profile. */
    Optional<ScanProfile> findDefault() throws Exception;

    /** Preferred profile for hosts of the given OS family. */
    Optional<ScanProfile> findDefaultForOsFamily(String osFamily) throws Exception;
}
