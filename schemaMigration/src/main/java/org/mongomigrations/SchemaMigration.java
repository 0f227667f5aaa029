package org.mongomigrations;

import java.nio.file.Path;

import org.mongomigrations.arguments.ArgLogUtils;
import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.commands.Apply;
import org.mongomigrations.commands.ApplyArgs;
import org.mongomigrations.commands.Extract;
import org.mongomigrations.commands.ExtractArgs;
import org.mongomigrations.commands.Result;
import org.mongomigrations.jcommander.EnvVarParameterPuller;

import com.beust.jcommander.JCommander;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;

/**
 * Command line entry point: {@code extract} a schema from a source, {@code apply} it to a destination.
 */
@Slf4j
public class SchemaMigration {

    static final String LOG_APPENDER_NAME = "SchemaMigrationRun";

    public static void main(String[] args) {
        new SchemaMigration().run(args);
    }

    protected void run(String[] args) {
        System.err.println("Starting program with: "
            + String.join(" ", ArgLogUtils.getRedactedArgs(args, ArgNameConstants.CENSORED_ARGS)));
        var migrationArgs = new MigrationArgs();
        var extractArgs = EnvVarParameterPuller.injectFromEnv(new ExtractArgs());
        var applyArgs = EnvVarParameterPuller.injectFromEnv(new ApplyArgs());
        var jCommander = JCommander.newBuilder()
            .addObject(migrationArgs)
            .addCommand(extractArgs)
            .addCommand(applyArgs)
            .build();
        jCommander.setProgramName("schema-migration");
        jCommander.parse(args);

        if (migrationArgs.help || jCommander.getParsedCommand() == null) {
            printTopLevelHelp(jCommander);
            return;
        }

        if (extractArgs.help || applyArgs.help) {
            printCommandUsage(jCommander);
            return;
        }

        var result = runCommand(jCommander, extractArgs, applyArgs);
        writeOutput(result.asCliOutput());
        reportLogPath();

        exitWithCode(result.getExitCode());
    }

    private Result runCommand(JCommander jCommander, ExtractArgs extractArgs, ApplyArgs applyArgs) {
        var command = MigrationCommands.fromString(jCommander.getParsedCommand());
        switch (command) {
            case EXTRACT:
                writeOutput("Starting Schema Extraction");
                return extract(extractArgs).execute();
            case APPLY:
            default:
                writeOutput("Starting Schema Apply");
                return apply(applyArgs).execute();
        }
    }

    public Extract extract(ExtractArgs arguments) {
        return new Extract(arguments);
    }

    public Apply apply(ApplyArgs arguments) {
        return new Apply(arguments);
    }

    protected void exitWithCode(int code) {
        System.exit(code);
    }

    protected void writeOutput(String output) {
        log.atInfo().setMessage("{}").addArgument(output).log();
    }

    private void printTopLevelHelp(JCommander commander) {
        var sb = new StringBuilder();
        sb.append("Usage: [options] [command] [commandOptions]").append(System.lineSeparator());
        sb.append("Options:").append(System.lineSeparator());
        for (var parameter : commander.getParameters()) {
            sb.append("  ").append(parameter.getNames());
            sb.append("    ").append(parameter.getDescription()).append(System.lineSeparator());
        }

        sb.append("Commands:").append(System.lineSeparator());
        for (var command : commander.getCommands().entrySet()) {
            sb.append("  ").append(command.getKey()).append(System.lineSeparator());
        }
        sb.append("Use --help with a specific command for more information.");
        writeOutput(sb.toString());
    }

    private void printCommandUsage(JCommander jCommander) {
        var sb = new StringBuilder();
        jCommander.getUsageFormatter().usage(jCommander.getParsedCommand(), sb);
        writeOutput(sb.toString());
    }

    private void reportLogPath() {
        try {
            var loggingContext = (LoggerContext) LogManager.getContext(false);
            var appender = loggingContext.getConfiguration().getAppender(LOG_APPENDER_NAME);
            if (appender instanceof FileAppender) {
                var logFilePath = Path.of(((FileAppender) appender).getFileName()).normalize();
                writeOutput("Consult " + logFilePath.toAbsolutePath() + " to see detailed logs for this run");
            }
        } catch (ClassCastException e) {
            log.debug("Log file location unavailable, logging is not backed by log4j-core", e);
        }
    }
}
