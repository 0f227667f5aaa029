package org.mongomigrations;

import com.beust.jcommander.Parameter;

public class MigrationArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;
}
