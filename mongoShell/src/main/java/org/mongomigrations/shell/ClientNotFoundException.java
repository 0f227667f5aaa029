package org.mongomigrations.shell;

import java.io.IOException;

/**
 * The external database client could not be launched, usually because it is not installed
 * or not on the {@code PATH}.
 */
public class ClientNotFoundException extends IOException {

    public ClientNotFoundException(String shellBinary, Throwable cause) {
        super("Unable to launch '" + shellBinary + "'. Install mongosh and make sure it is on the PATH, "
            + "or point --mongosh-path at the executable", cause);
    }
}
