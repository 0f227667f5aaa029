package org.mongomigrations.workload;

import java.nio.file.Path;

import org.mongomigrations.arguments.ArgLogUtils;
import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.jcommander.EnvVarParameterPuller;
import org.mongomigrations.workload.commands.CreateIndexes;
import org.mongomigrations.workload.commands.CreateIndexesArgs;
import org.mongomigrations.workload.commands.Explain;
import org.mongomigrations.workload.commands.ExplainArgs;
import org.mongomigrations.workload.commands.RunQueries;
import org.mongomigrations.workload.commands.RunQueriesArgs;
import org.mongomigrations.workload.commands.WorkloadRunResult;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;

/**
 * Command line entry point for index creation, query benchmarking and explain capture against
 * one collection.
 */
@Slf4j
public class WorkloadTools {

    static final String LOG_APPENDER_NAME = "WorkloadToolsRun";
    static final String BANNER = "=".repeat(60);

    static class TopLevelArgs {
        @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
        public boolean help;
    }

    public static void main(String[] args) {
        new WorkloadTools().run(args);
    }

    protected void run(String[] args) {
        System.err.println("Starting program with: "
            + String.join(" ", ArgLogUtils.getRedactedArgs(args, ArgNameConstants.CENSORED_ARGS)));
        var topLevelArgs = new TopLevelArgs();
        var createIndexesArgs = EnvVarParameterPuller.injectFromEnv(new CreateIndexesArgs());
        var runQueriesArgs = EnvVarParameterPuller.injectFromEnv(new RunQueriesArgs());
        var explainArgs = EnvVarParameterPuller.injectFromEnv(new ExplainArgs());
        var jCommander = JCommander.newBuilder()
            .addObject(topLevelArgs)
            .addCommand(createIndexesArgs)
            .addCommand(runQueriesArgs)
            .addCommand(explainArgs)
            .build();
        jCommander.setProgramName("workload-tools");
        jCommander.parse(args);

        if (topLevelArgs.help || jCommander.getParsedCommand() == null) {
            printTopLevelHelp(jCommander);
            return;
        }

        if (createIndexesArgs.help || runQueriesArgs.help || explainArgs.help) {
            printCommandUsage(jCommander);
            return;
        }

        var command = WorkloadCommands.fromString(jCommander.getParsedCommand());
        WorkloadRunResult result;
        switch (command) {
            case CREATE_INDEXES:
                writeOutput(BANNER + System.lineSeparator() + "MongoDB Index Creator" + System.lineSeparator() + BANNER);
                result = createIndexes(createIndexesArgs).execute();
                break;
            case RUN_QUERIES:
                writeOutput(BANNER + System.lineSeparator() + "MongoDB Query Executor" + System.lineSeparator() + BANNER);
                result = runQueries(runQueriesArgs).execute();
                break;
            case EXPLAIN:
            default:
                writeOutput(BANNER + System.lineSeparator() + "MongoDB Explain Generator" + System.lineSeparator() + BANNER);
                result = explain(explainArgs).execute();
                break;
        }

        writeOutput(result.asCliOutput());
        reportLogPath();
        exitWithCode(result.getExitCode());
    }

    public CreateIndexes createIndexes(CreateIndexesArgs arguments) {
        return new CreateIndexes(arguments);
    }

    public RunQueries runQueries(RunQueriesArgs arguments) {
        return new RunQueries(arguments);
    }

    public Explain explain(ExplainArgs arguments) {
        return new Explain(arguments);
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
