package utilities;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Static logging facade over java.util.logging.
 *
 * System properties:
 *   suffixtree.log.level  console level (default INFO)
 *   suffixtree.log.file   when set, also append everything to this file
 */
public class SuffixTreeLogger {

    public static final String LEVEL_PROPERTY = "suffixtree.log.level";
    public static final String FILE_PROPERTY = "suffixtree.log.file";

    private static final Logger logger = Logger.getLogger(SuffixTreeLogger.class.getName());
    private static final ConsoleHandler consoleHandler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false); // Disable default console handler

        Level consoleLevel = parseLevel(System.getProperty(LEVEL_PROPERTY), Level.INFO);
        consoleHandler.setLevel(consoleLevel);
        logger.addHandler(consoleHandler);

        String file = System.getProperty(FILE_PROPERTY);
        if (file != null && !file.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(file, true); // append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to open log file " + file, e);
            }
        }

        logger.setLevel(Level.ALL);
    }

    private SuffixTreeLogger() {
    }

    public static Level consoleLevel() {
        return consoleHandler.getLevel();
    }

    // Overrides suffixtree.log.level for the rest of the run.
    public static void setConsoleLevel(Level level) {
        consoleHandler.setLevel(Objects.requireNonNull(level, "level"));
    }

    static Level parseLevel(String value, Level fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }
}
