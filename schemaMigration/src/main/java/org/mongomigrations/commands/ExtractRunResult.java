package org.mongomigrations.commands;

import java.nio.file.Path;

import org.mongomigrations.extract.SchemaSummary;
import org.mongomigrations.schema.model.SchemaSnapshot;

import lombok.Builder;
import lombok.Getter;

@Builder
public class ExtractRunResult implements Result {
    @Getter
    private final SchemaSnapshot snapshot;
    @Getter
    private final Path outputFile;
    @Getter
    private final String errorMessage;
    @Getter
    private final int exitCode;

    @Override
    public String asCliOutput() {
        var sb = new StringBuilder();
        if (snapshot != null) {
            sb.append(SchemaSummary.describe(snapshot)).append(System.lineSeparator());
        }
        sb.append("Results:").append(System.lineSeparator());
        if (errorMessage != null) {
            sb.append("   Extraction failed").append(System.lineSeparator());
            sb.append(errorMessage).append(System.lineSeparator());
        } else {
            sb.append("   Schema saved to ").append(outputFile.toAbsolutePath()).append(System.lineSeparator());
            sb.append(System.lineSeparator()).append("Next steps:").append(System.lineSeparator());
            sb.append("   1. Review (and edit if needed) ").append(outputFile).append(System.lineSeparator());
            sb.append("   2. Run the apply command against the destination").append(System.lineSeparator());
        }
        return sb.toString();
    }
}
