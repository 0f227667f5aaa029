package org.mongomigrations.apply;

import java.util.List;

/**
 * Script text plus the objects it will attempt and those it deliberately leaves out.
 */
public record GeneratedScript(
    String body,
    List<ApplyTarget> targets,
    List<ApplyTarget> skipped
) {

    public GeneratedScript {
        targets = List.copyOf(targets);
        skipped = List.copyOf(skipped);
    }
}
