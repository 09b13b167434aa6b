package net.scanorama.adapter.jdbc.repo;

import net.scanorama.adapter.jdbc.JdbcUtil;
import net.scanorama.core.model.HostSelectionFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Host selection SQL. Every predicate of the filter is ANDed; the CIDR scopes are ORed
 * among themselves. Hosts flagged ignore_scanning never match.
 */
public final class HostQueryBuilder {
    private HostQueryBuilder() {}

    public record HostQuery(String sql, List<Object> args) {}

    public static HostQuery build(HostSelectionFilter filter) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, host(ip_address) AS ip_address, hostname, os_family, status, last_seen
                  FROM hosts
                 WHERE ignore_scanning = false""");
        List<Object> args = new ArrayList<>();

        if (filter.liveOnly()) {
            sql.append("\n   AND status = 'up'");
        }
        if (filter.seenSince() != null) {
            sql.append("\n   AND last_seen >= ?");
            args.add(JdbcUtil.ts(filter.seenSince()));
        }
        if (!filter.osFamilies().isEmpty()) {
            StringJoiner in = new StringJoiner(", ", "\n   AND os_family IN (", ")");
            for (String family : filter.osFamilies()) {
                in.add("?");
                args.add(family);
            }
            sql.append(in);
        }
        if (!filter.networks().isEmpty()) {
            StringJoiner any = new StringJoiner(" OR ", "\n   AND (", ")");
            for (String cidr : filter.networks()) {
                any.add("ip_address <<= ?::inet");
                args.add(cidr);
            }
            sql.append(any);
        }
        sql.append("\n ORDER BY last_seen DESC NULLS LAST");
        return new HostQuery(sql.toString(), List.copyOf(args));
    }
}
