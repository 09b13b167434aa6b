package net.scanorama.adapter.jdbc.repo;

import net.scanorama.adapter.jdbc.TxContext;
import net.scanorama.adapter.jdbc.mapper.RowMappers;
import net.scanorama.core.model.ScanProfile;
import net.scanorama.core.spi.ProfileRepository;

import java.sql.ResultSet;
import java.util.Optional;

/** Read-only view of scan_profiles. */
public final class JdbcProfileRepository implements ProfileRepository {
    public static final String DEFAULT_PROFILE_ID = "generic-default";

    private final String defaultProfileId;

    public JdbcProfileRepository() { this(DEFAULT_PROFILE_ID); }

    public JdbcProfileRepository(String defaultProfileId) { this.defaultProfileId = defaultProfileId; }

    @Override
    public Optional<ScanProfile> findById(String id) throws Exception {
        return queryOne("SELECT * FROM scan_profiles WHERE id = ?", id);
    }

    @Override
    public Optional<ScanProfile> findDefault() throws Exception {
        return findById(defaultProfileId);
    }

    /** Highest priority profile listing the family; ties broken by id. */
    @Override
    public Optional<ScanProfile> findDefaultForOsFamily(String osFamily) throws Exception {
        return queryOne("""
                SELECT *
                  FROM scan_profiles
                 WHERE ? = ANY(os_family)
                 ORDER BY priority DESC, id
                 LIMIT 1
            """, osFamily);
    }

    private Optional<ScanProfile> queryOne(String sql, String arg) throws Exception {
        try (var ps = TxContext.required().prepareStatement(sql)) {
            ps.setString(1, arg);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toProfile(rs));
            }
        }
    }
}
