package org.mongomigrations.arguments;

import java.util.List;

/**
 * Flag names shared by the command line tools.
 */
public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    public static final String SOURCE_CONNECTION_STRING_ARG = "--source-mongodb-connection-string";
    public static final String DEST_CONNECTION_STRING_ARG = "--dest-mongodb-connection-string";
    public static final String CONNECTION_STRING_ARG = "--mongodb-connection-string";
    public static final String DATABASE_ARG = "--mongodb-database";
    public static final String COLLECTION_ARG = "--mongodb-collection";
    public static final String INDEXES_FILE_ARG = "--indexes-file";
    public static final String QUERIES_FILE_ARG = "--queries-file";
    public static final String TIMEOUT_SECONDS_ARG = "--timeout-seconds";
    public static final String EXPLAIN_TIMEOUT_SECONDS_ARG = "--explain-timeout-seconds";
    public static final String DATABASE_PREFIX_ARG = "--database-prefix";
    public static final String MONGOSH_PATH_ARG = "--mongosh-path";

    public static final List<String> CENSORED_ARGS = List.of(
        SOURCE_CONNECTION_STRING_ARG,
        DEST_CONNECTION_STRING_ARG,
        CONNECTION_STRING_ARG
    );
}
