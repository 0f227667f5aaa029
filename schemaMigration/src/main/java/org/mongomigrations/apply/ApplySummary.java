package org.mongomigrations.apply;

import java.util.List;

/**
 * Counters and error records parsed from the summary block the apply script prints last.
 */
public record ApplySummary(
    int databasesCreated,
    int collectionsCreated,
    int indexesCreated,
    int errorCount,
    List<ApplyError> errors
) {

    public ApplySummary {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return errorCount > 0 || !errors.isEmpty();
    }
}
