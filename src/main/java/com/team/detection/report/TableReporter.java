package com.team.detection.report;

import com.team.detection.api.TeamDetectionReport;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.source.ProfileSource;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Plain text table of the found players in discovery order.
 *
 * <pre>
 * Name:                             SteamID:           Link:
 * Alice                             76561198000000001  https://steamcommunity.com/profiles/76561198000000001/?l=english
 * </pre>
 */
public class TableReporter implements ResultReporter {

    private static final String ROW_FORMAT = "%-34s%-19s%s%n";

    private final ProfileSource profileSource;

    public TableReporter(ProfileSource profileSource) {
        this.profileSource = Objects.requireNonNull(profileSource, "profileSource is required");
    }

    @Override
    public void write(TeamDetectionReport report, Writer writer) throws IOException {
        writer.write(String.format("%nTeam Detector Result:%n%n"));
        writer.write(String.format(ROW_FORMAT, "Name:", "SteamID:", "Link:"));
        for (ProfileIdentity player : report.foundPlayers()) {
            String numericId = player.getNumericId().orElse("");
            writer.write(String.format(ROW_FORMAT, player.getDisplayName(), numericId,
                    profileSource.profileLink(numericId)));
        }
        writer.flush();
    }

    @Override
    public String getFormat() {
        return "text";
    }
}
