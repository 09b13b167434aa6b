package net.scanorama.adapter.jdbc.repo;

import net.scanorama.adapter.jdbc.TxContext;
import net.scanorama.adapter.jdbc.mapper.RowMappers;
import net.scanorama.core.model.Host;
import net.scanorama.core.model.HostSelectionFilter;
import net.scanorama.core.spi.HostInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

public final class JdbcHostInventory implements HostInventory {
    private static final Logger log = LoggerFactory.getLogger(JdbcHostInventory.class);

    @Override
    public List<Host> findHosts(HostSelectionFilter filter) throws Exception {
        HostQueryBuilder.HostQuery q = HostQueryBuilder.build(filter);
        log.debug("Host selection: {} {}", q.sql(), q.args());
        try (var ps = TxContext.required().prepareStatement(q.sql())) {
            for (int i = 0; i < q.args().size(); i++) ps.setObject(i + 1, q.args().get(i));
            try (ResultSet rs = ps.executeQuery()) {
                List<Host> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toHost(rs));
                return out;
            }
        }
    }
}
