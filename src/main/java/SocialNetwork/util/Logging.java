package SocialNetwork.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static logging entry points shared by the graph, the shell and the exporters.
 */
public class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("SocialNetwork");

    public static void logError(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }

    public static void logWarn(String message) {
        LOGGER.warn(message);
    }

    public static void logInfo(String message) {
        LOGGER.info(message);
    }

    public static void logDebug(String message) {
        LOGGER.debug(message);
    }
}
