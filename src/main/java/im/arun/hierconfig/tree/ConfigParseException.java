package im.arun.hierconfig.tree;

/**
 * Configuration text that cannot be turned into a tree.
 */
public class ConfigParseException extends RuntimeException {

    public ConfigParseException(String message) {
        super(message);
    }
}
