package symreg.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public final class LoggingConfig {

    public static final String ROOT_LOGGER = "symreg";

    private LoggingConfig() {
    }

    /**
     * Routes everything logged below the {@code symreg} package to
     * {@code logFile}. Console output of the host application is left alone.
     */
    public static FileHandler setup(Path logFile, Level level) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileHandler fileHandler = new FileHandler(logFile.toString(), true);
        fileHandler.setFormatter(new ThreadAwareFormatter());
        fileHandler.setLevel(level);

        Logger symregLogger = Logger.getLogger(ROOT_LOGGER);
        symregLogger.addHandler(fileHandler);
        symregLogger.setLevel(level);
        return fileHandler;
    }

    public static Logger getLogger(Class<?> clazz) {
        return Logger.getLogger(clazz.getName());
    }
}

class ThreadAwareFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%s] %s %s: %s%n",
                Thread.currentThread().getName(),
                record.getLevel(),
                record.getLoggerName(),
                formatMessage(record)));

        Throwable thrown = record.getThrown();
        if (thrown != null) {
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                thrown.printStackTrace(pw);
            }
            sb.append(sw);
        }
        return sb.toString();
    }
}
