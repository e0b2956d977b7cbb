package com.voterimport.voterimport.storage;

import com.voterimport.voterimport.dedup.DedupScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.voterimport.voterimport.storage.VoterRecords.voter;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DuplicateAddressAnalyzerTest {

    private static final DedupScope NC = DedupScope.forState("NC");

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private DuplicateAddressAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        database = SqliteDatabase.open(tempDir.resolve("voters.db"));
        SqliteStorageSink sink = new SqliteStorageSink(database.jdbcTemplate(), Clock.systemUTC());
        sink.ensureScope(NC);
        sink.insert(NC, voter("A3", "Carl", "Poe", "1 Main ST", "RALEIGH", "27601"));
        sink.insert(NC, voter("A1", "Jane", "Doe", "1 Main ST", "RALEIGH", "27601"));
        sink.insert(NC, voter("A2", "John", "Doe", "1 Main ST", "RALEIGH", "27601"));
        sink.insert(NC, voter("B1", "Ann", "Lee", "2 Oak AVE", "CARY", "27511"));
        sink.insert(NC, voter("B2", "Bo", "Lee", "2 Oak AVE", "CARY", "27511"));
        sink.insert(NC, voter("C1", "Dee", "Kim", "3 Elm ST", "CARY", "27511"));
        sink.insert(NC, voter("D1", "Eve", "Ray", "", "CARY", "27511"));
        analyzer = new DuplicateAddressAnalyzer(database.jdbcTemplate());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldGroupVotersAtSharedAddresses() {
        DuplicateAddressReport report = analyzer.analyze(NC, 2);

        assertEquals("voters_nc", report.table());
        assertEquals(3, report.totalAddresses());
        assertEquals(2, report.groups().size());
        DuplicateAddressReport.AddressGroup largest = report.groups().get(0);
        assertEquals("1 Main ST", largest.address());
        assertEquals("RALEIGH", largest.city());
        assertEquals("27601", largest.zip());
        assertEquals(3, largest.voterCount());
        assertEquals(List.of("A1", "A2", "A3"), largest.voters().stream().map(DuplicateAddressReport.Voter::voterId).toList());
        assertEquals("Jane Doe", largest.voters().get(0).name());
        assertEquals(Map.of(3L, 1L, 2L, 1L), report.votersPerAddress());
        assertEquals(5, report.votersAtSharedAddresses());
    }

    @Test
    void shouldOnlyReportAddressesAtOrAboveThreshold() {
        DuplicateAddressReport report = analyzer.analyze(NC, 3);

        assertEquals(1, report.groups().size());
        assertTrue(analyzer.analyze(NC, 4).groups().isEmpty());
        assertEquals(3, analyzer.analyze(NC, 1).groups().size());
    }

    @Test
    void shouldRenderMarkdownReport() {
        String markdown = analyzer.toMarkdown(analyzer.analyze(NC, 2));

        assertTrue(markdown.startsWith("# Duplicate Address Analysis Report"));
        assertTrue(markdown.contains("- Total unique addresses analyzed: 3"));
        assertTrue(markdown.contains("- Addresses with multiple voters: 2"));
        assertTrue(markdown.contains("- Total voters at duplicate addresses: 5"));
        assertTrue(markdown.contains("| 3 | 1 |"));
        assertTrue(markdown.contains("### 1 Main ST, RALEIGH, 27601"));
        assertTrue(markdown.contains("**Number of Voters:** 3"));
        assertTrue(markdown.contains("| A1 | Jane Doe | 2020-01-01 |"));
        assertTrue(markdown.indexOf("### 1 Main ST") < markdown.indexOf("### 2 Oak AVE"));
    }

    @Test
    void shouldRejectThresholdBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(NC, 0));
    }
}
