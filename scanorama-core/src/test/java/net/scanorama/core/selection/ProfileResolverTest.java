package net.scanorama.core.selection;

import net.scanorama.core.model.Host;
import net.scanorama.core.model.ScanProfile;
import net.scanorama.core.service.SchedulerException;
import net.scanorama.core.service.SchedulerException.Reason;
import net.scanorama.core.spi.ProfileRepository;
import net.scanorama.core.support.DirectTxRunner;
import net.scanorama.core.support.Hosts;
import net.scanorama.core.support.InMemoryProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static net.scanorama.core.support.InMemoryProfileRepository.profile;
import static org.junit.jupiter.api.Assertions.*;

class ProfileResolverTest {

    InMemoryProfileRepository profiles;
    ProfileResolver resolver;

    Host linux = Hosts.up("10.0.0.5", "linux", Instant.now());
    Host unknownOs = Hosts.up("10.0.0.6", null, Instant.now());

    @BeforeEach
    void setUp() {
        profiles = new InMemoryProfileRepository()
                .add(profile(InMemoryProfileRepository.DEFAULT_ID, 0))
                .add(profile("linux-basic", 10, "linux"))
                .add(profile("linux-deep", 50, "linux"))
                .add(profile("windows-basic", 10, "windows"));
        resolver = new ProfileResolver(profiles, new DirectTxRunner());
    }

    @Test
    void explicitProfile_winsOverOsDefault() throws Exception {
        assertEquals("windows-basic", resolver.resolve(linux, "windows-basic").id());
    }

    @Test
    void missingExplicitProfile_failsWithoutFallback() {
        SchedulerException e = assertThrows(SchedulerException.class, () -> resolver.resolve(linux, "gone"));
        assertEquals(Reason.PROFILE_NOT_FOUND, e.reason());
    }

    @Test
    void autoOrBlank_usesHighestPriorityOsDefault() throws Exception {
        assertEquals("linux-deep", resolver.resolve(linux, "auto").id());
        assertEquals("linux-deep", resolver.resolve(linux, null).id());
        assertEquals("linux-deep", resolver.resolve(linux, " ").id());
    }

    @Test
    void hostWithoutOsFamily_fallsBackToGlobalDefault() throws Exception {
        assertEquals(InMemoryProfileRepository.DEFAULT_ID, resolver.resolve(unknownOs, null).id());

        Host bsd = Hosts.up("10.0.0.7", "freebsd", Instant.now());
        assertEquals(InMemoryProfileRepository.DEFAULT_ID, resolver.resolve(bsd, null).id());
    }

    @Test
    void noDefaultAtAll_isNoProfileAvailable() {
        resolver = new ProfileResolver(new InMemoryProfileRepository(), new DirectTxRunner());
        SchedulerException e = assertThrows(SchedulerException.class, () -> resolver.resolve(unknownOs, null));
        assertEquals(Reason.NO_PROFILE_AVAILABLE, e.reason());
    }

    @Test
    void repositoryFailure_isPersistenceFailed() {
        ProfileRepository broken = new ProfileRepository() {
            @Override public Optional<ScanProfile> findById(String id) throws Exception { throw new SQLException("down"); }
            @Override public Optional<ScanProfile> findDefault() throws Exception { throw new SQLException("down"); }
            @Override public Optional<ScanProfile> findDefaultForOsFamily(String f) throws Exception { throw new SQLException("down"); }
        };
        resolver = new ProfileResolver(broken, new DirectTxRunner());

        SchedulerException e = assertThrows(SchedulerException.class, () -> resolver.resolve(linux, null));
        assertEquals(Reason.PERSISTENCE_FAILED, e.reason());
    }
}
