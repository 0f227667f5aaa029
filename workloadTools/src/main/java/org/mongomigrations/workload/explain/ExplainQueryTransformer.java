package org.mongomigrations.workload.explain;

import java.util.regex.Pattern;

import org.mongomigrations.shell.ShellLiterals;

/**
 * Rewrites a benchmark query into the expression that explains it.
 */
public final class ExplainQueryTransformer {

    private static final Pattern COUNT_DOCUMENTS =
        Pattern.compile("targetDb\\.([\\w-]+)\\.countDocuments\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern COUNT_DOCUMENTS_GET_COLLECTION =
        Pattern.compile("targetDb\\.getCollection\\((\"[^\"]*\"|'[^']*')\\)\\.countDocuments\\((.*)\\)", Pattern.DOTALL);

    private ExplainQueryTransformer() {
        throw new IllegalStateException("Utility class");
    }

    public static String toExplain(String query, ExplainVerbosity verbosity) {
        var modeLiteral = ShellLiterals.string(verbosity.getMode());

        // countDocuments returns a number, so it is explained as a count command
        if (query.contains("countDocuments(")) {
            String collectionLiteral = null;
            String filter = null;
            var matcher = COUNT_DOCUMENTS.matcher(query);
            if (matcher.find()) {
                collectionLiteral = ShellLiterals.string(matcher.group(1));
                filter = matcher.group(2);
            } else {
                var getCollection = COUNT_DOCUMENTS_GET_COLLECTION.matcher(query);
                if (getCollection.find()) {
                    collectionLiteral = getCollection.group(1);
                    filter = getCollection.group(2);
                }
            }
            if (collectionLiteral != null) {
                var countFilter = filter.isBlank() ? "{}" : filter;
                return "targetDb.runCommand({explain: {count: " + collectionLiteral + ", query: " + countFilter
                    + "}, verbosity: " + modeLiteral + "})";
            }
        }

        if (query.contains(".toArray()")) {
            return query.replace(".toArray()", ".explain(" + modeLiteral + ")");
        }
        return query.stripTrailing() + ".explain(" + modeLiteral + ")";
    }
}
