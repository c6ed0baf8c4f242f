package com.team.detection.report;

import com.team.detection.api.TeamDetectionReport;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes a detection report in a specific format.
 */
public interface ResultReporter {

    /**
     * Writes the report. The writer is flushed but not closed.
     */
    void write(TeamDetectionReport report, Writer writer) throws IOException;

    /**
     * Returns the format produced by this reporter (e.g., "text", "html").
     */
    String getFormat();
}
