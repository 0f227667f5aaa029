package org.mongomigrations.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.mongomigrations.shell.ConnectionString;

public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * Masks the credentials of connection-string flags, in both {@code --flag value} and
     * {@code --flag=value} form, and of any other argument that embeds a credential-bearing URI.
     */
    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredArgs) {
        List<String> redactedArgs = new ArrayList<>();
        boolean shouldCensorNext = false;

        for (String arg : args) {
            int equalsAt = arg.indexOf('=');
            if (shouldCensorNext) {
                redactedArgs.add(ConnectionString.mask(arg));
                shouldCensorNext = false;
            } else if (censoredArgs.contains(arg)) {
                redactedArgs.add(arg);
                shouldCensorNext = true;
            } else if (equalsAt > 0 && censoredArgs.contains(arg.substring(0, equalsAt))) {
                redactedArgs.add(arg.substring(0, equalsAt + 1) + ConnectionString.mask(arg.substring(equalsAt + 1)));
            } else {
                redactedArgs.add(ConnectionString.maskEmbedded(arg));
            }
        }

        return redactedArgs;
    }
}
