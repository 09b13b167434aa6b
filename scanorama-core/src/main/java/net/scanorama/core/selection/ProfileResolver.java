package net.scanorama.core.selection;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScanProfile;
import net.scanorama.core.service.SchedulerException;
import net.scanorama.core.service.SchedulerException.Reason;
import net.scanorama.core.spi.ProfileRepository;
import net.scanorama.core.spi.TxRunner;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Picks the scan profile for a host: explicit id → OS family default → global default.
 * An explicit id that does not exist fails instead of falling back.
 */
public final class ProfileResolver {
    private final ProfileRepository profiles;
    private final TxRunner tx;

    public ProfileResolver(ProfileRepository profiles, TxRunner tx) {
        this.profiles = profiles;
        this.tx = tx;
    }

    public ScanProfile resolve(Host host, String explicitProfileId) throws SchedulerException {
        if (isExplicit(explicitProfileId)) {
            return find(() -> profiles.findById(explicitProfileId))
                    .orElseThrow(() -> new SchedulerException(Reason.PROFILE_NOT_FOUND,
                            "profile not found: " + explicitProfileId));
        }

        if (host.hasOsFamily()) {
            Optional<ScanProfile> osDefault = find(() -> profiles.findDefaultForOsFamily(host.osFamily()));
            if (osDefault.isPresent()) return osDefault.get();
        }

        return find(profiles::findDefault)
                .orElseThrow(() -> new SchedulerException(Reason.NO_PROFILE_AVAILABLE,
                        "no profile available for host " + host.ipAddress()));
    }

    private static boolean isExplicit(String profileId) {
        return profileId != null && !profileId.isBlank() && !ScanJobConfig.AUTO_PROFILE.equalsIgnoreCase(profileId);
    }

    private Optional<ScanProfile> find(Callable<Optional<ScanProfile>> lookup) throws SchedulerException {
        try {
            return tx.required(lookup);
        } catch (Exception e) {
            throw new SchedulerException(Reason.PERSISTENCE_FAILED, "profile lookup failed: " + e.getMessage(), e);
        }
    }
}
