package org.neuralchilli.acms.plugin;

/**
 * Thrown when a lifecycle hook fails under {@link HookFailurePolicy#ABORT}.
 */
public class HookFailedException extends RuntimeException {

    private final String pluginName;
    private final String hook;

    public HookFailedException(String pluginName, String hook, Throwable cause) {
        super("Plugin '" + pluginName + "' failed in " + hook + ": " + cause.getMessage(), cause);
        this.pluginName = pluginName;
        this.hook = hook;
    }

    public String pluginName() {
        return pluginName;
    }

    public String hook() {
        return hook;
    }
}
