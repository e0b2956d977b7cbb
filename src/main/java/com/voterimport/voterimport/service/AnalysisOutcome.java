package com.voterimport.voterimport.service;

import com.voterimport.voterimport.storage.DuplicateAddressReport;

import java.nio.file.Path;

/**
 * @param reportPath file the Markdown was written to, or {@code null} when it was not written
 */
public record AnalysisOutcome(DuplicateAddressReport report, String markdown, Path reportPath) {
}
