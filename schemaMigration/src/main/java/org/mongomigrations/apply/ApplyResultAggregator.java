package org.mongomigrations.apply;

import java.util.ArrayList;
import java.util.LinkedHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds the targets a script attempted with the error records it reported. A target with a
 * matching error record failed; every other attempted target was created.
 */
@Slf4j
public class ApplyResultAggregator {

    public ApplyReport aggregate(GeneratedScript script, ApplySummary summary) {
        var errorsByTarget = new LinkedHashMap<ApplyTarget, ApplyError>();
        var unmatched = new ArrayList<ApplyError>();
        for (var error : summary.errors()) {
            var target = error.toTarget().filter(script.targets()::contains);
            if (target.isPresent()) {
                errorsByTarget.putIfAbsent(target.get(), error);
            } else {
                log.warn("Error record does not match any generated target: {}", error.describe());
                unmatched.add(error);
            }
        }

        var results = new ArrayList<ApplyResult>();
        for (var target : script.targets()) {
            var error = errorsByTarget.get(target);
            results.add(error == null ? ApplyResult.created(target) : ApplyResult.failed(target, error.error()));
        }
        for (var target : script.skipped()) {
            results.add(ApplyResult.skipped(target, "identity index is created with the collection"));
        }
        return new ApplyReport(results, summary, unmatched);
    }
}
