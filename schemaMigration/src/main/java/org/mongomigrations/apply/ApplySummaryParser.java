package org.mongomigrations.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the summary block of an apply script run out of its standard output.
 */
@Slf4j
public class ApplySummaryParser {

    private final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public boolean hasSummary(String stdout) {
        return stdout != null && lastCounter(stdout.lines().toList(), ApplyScriptGenerator.ERRORS).isPresent();
    }

    public ApplySummary parse(String stdout) throws ScriptOutputException {
        if (stdout == null) {
            throw new ScriptOutputException("Apply script produced no output");
        }
        var lines = stdout.lines().toList();
        var errorsLine = lastIndexOf(lines, ApplyScriptGenerator.ERRORS);
        if (errorsLine < 0) {
            throw new ScriptOutputException("Apply script output has no summary block");
        }

        var databases = requireCounter(lines, ApplyScriptGenerator.DATABASES_CREATED);
        var collections = requireCounter(lines, ApplyScriptGenerator.COLLECTIONS_CREATED);
        var indexes = requireCounter(lines, ApplyScriptGenerator.INDEXES_CREATED);
        var errorCount = requireCounter(lines, ApplyScriptGenerator.ERRORS);

        var errors = new ArrayList<ApplyError>();
        boolean inDetails = false;
        for (int i = errorsLine + 1; i < lines.size(); i++) {
            var line = lines.get(i);
            if (line.equals(ApplyScriptGenerator.ERROR_DETAILS)) {
                inDetails = true;
            } else if (inDetails && line.startsWith(ApplyScriptGenerator.ERROR_RECORD_PREFIX)) {
                errors.add(parseError(line.substring(ApplyScriptGenerator.ERROR_RECORD_PREFIX.length())));
            } else if (inDetails && line.startsWith(ApplyScriptGenerator.RULE)) {
                break;
            }
        }

        if (errors.size() != errorCount) {
            log.warn("Apply summary reports {} errors but lists {} error records", errorCount, errors.size());
        }
        return new ApplySummary(databases, collections, indexes, errorCount, errors);
    }

    private ApplyError parseError(String json) throws ScriptOutputException {
        try {
            return objectMapper.readValue(json, ApplyError.class);
        } catch (JsonProcessingException e) {
            throw new ScriptOutputException("Malformed error record in apply summary: " + json, e);
        }
    }

    private static int requireCounter(List<String> lines, String label) throws ScriptOutputException {
        var value = lastCounter(lines, label);
        if (value.isEmpty()) {
            throw new ScriptOutputException("Apply script summary is missing '" + label.trim() + "'");
        }
        return value.getAsInt();
    }

    private static OptionalInt lastCounter(List<String> lines, String label) {
        int index = lastIndexOf(lines, label);
        if (index < 0) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(lines.get(index).substring(label.length()).trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric summary line: {}", lines.get(index));
            return OptionalInt.empty();
        }
    }

    private static int lastIndexOf(List<String> lines, String label) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).startsWith(label)) {
                return i;
            }
        }
        return -1;
    }
}
