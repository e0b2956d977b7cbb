package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.config.VoterImportConstants;
import com.voterimport.voterimport.dedup.DedupScope;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds addresses shared by many registered voters in one scope table and renders the result as Markdown.
 */
public class DuplicateAddressAnalyzer {

    private final JdbcTemplate jdbcTemplate;

    public DuplicateAddressAnalyzer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public DuplicateAddressReport analyze(DedupScope scope, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Threshold must be at least 1: " + threshold);
        }
        String table = scope.table();
        if (!table.matches(VoterImportConstants.VALID_TABLE_NAME_REGEX)) {
            throw new IllegalArgumentException(VoterImportConstants.MSG_INVALID_TABLE.formatted(table));
        }

        Long total = jdbcTemplate.queryForObject(
                """
                SELECT COUNT(*) FROM (
                    SELECT DISTINCT address, city, zip FROM %s
                    WHERE address IS NOT NULL AND address != ''
                )
                """.formatted(table),
                Long.class
        );

        // voters are read after the group query so the single pooled connection is free again
        List<DuplicateAddressReport.AddressGroup> counted = jdbcTemplate.query(
                """
                SELECT address, city, zip, COUNT(*) AS voter_count
                FROM %s
                WHERE address IS NOT NULL AND address != ''
                GROUP BY address, city, zip
                HAVING COUNT(*) >= ?
                ORDER BY voter_count DESC, address, city, zip
                """.formatted(table),
                (rs, rowNum) -> new DuplicateAddressReport.AddressGroup(rs.getString("address"), rs.getString("city"),
                        rs.getString("zip"), rs.getLong("voter_count"), List.of()),
                threshold
        );
        List<DuplicateAddressReport.AddressGroup> groups = new ArrayList<>(counted.size());
        for (DuplicateAddressReport.AddressGroup group : counted) {
            groups.add(new DuplicateAddressReport.AddressGroup(group.address(), group.city(), group.zip(),
                    group.voterCount(), votersAt(table, group.address(), group.city(), group.zip())));
        }

        Map<Long, Long> votersPerAddress = new LinkedHashMap<>();
        for (DuplicateAddressReport.AddressGroup group : groups) {
            votersPerAddress.merge(group.voterCount(), 1L, Long::sum);
        }
        return new DuplicateAddressReport(table, threshold, total == null ? 0 : total, groups, votersPerAddress);
    }

    public String toMarkdown(DuplicateAddressReport report) {
        StringBuilder out = new StringBuilder();
        out.append("# Duplicate Address Analysis Report\n\n");
        out.append("Table `").append(report.table()).append("`, threshold ").append(report.threshold()).append("\n\n");

        out.append("## Summary\n\n");
        out.append("- Total unique addresses analyzed: ").append(String.format("%,d", report.totalAddresses())).append('\n');
        out.append("- Addresses with multiple voters: ").append(String.format("%,d", report.groups().size())).append('\n');
        out.append("- Total voters at duplicate addresses: ")
                .append(String.format("%,d", report.votersAtSharedAddresses())).append("\n\n");

        out.append("## Distribution of Voters per Address\n\n");
        out.append("| Number of Voters | Number of Addresses |\n");
        out.append("|-----------------|-------------------|\n");
        report.votersPerAddress().forEach((voters, addresses) ->
                out.append("| ").append(voters).append(" | ").append(String.format("%,d", addresses)).append(" |\n"));
        out.append('\n');

        out.append("## Detailed Results\n\n");
        for (DuplicateAddressReport.AddressGroup group : report.groups()) {
            out.append("### ").append(group.address()).append(", ").append(nullToEmpty(group.city()))
                    .append(", ").append(nullToEmpty(group.zip())).append('\n');
            out.append("**Number of Voters:** ").append(group.voterCount()).append("\n\n");
            out.append("| Voter ID | Name | Registration Date |\n");
            out.append("|----------|------|------------------|\n");
            for (DuplicateAddressReport.Voter voter : group.voters()) {
                out.append("| ").append(voter.voterId())
                        .append(" | ").append(voter.name())
                        .append(" | ").append(nullToEmpty(voter.registrationDate()))
                        .append(" |\n");
            }
            out.append('\n');
        }
        return out.toString();
    }

    private List<DuplicateAddressReport.Voter> votersAt(String table, String address, String city, String zip) {
        // IS matches NULL city or zip as well
        return jdbcTemplate.query(
                """
                SELECT voter_id, TRIM(COALESCE(first_name, '') || ' ' || COALESCE(last_name, '')) AS name,
                       registration_date
                FROM %s
                WHERE address = ? AND city IS ? AND zip IS ?
                ORDER BY voter_id
                """.formatted(table),
                (rs, rowNum) -> new DuplicateAddressReport.Voter(
                        rs.getString("voter_id"),
                        rs.getString("name"),
                        rs.getString("registration_date")
                ),
                address, city, zip
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
