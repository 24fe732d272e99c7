package io.defcheck.cli.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.defcheck.cli.config.CheckerConfig;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.format} and {@code logging.level} to Logback once the
 * checker configuration is resolved.
 *
 * <p>
 * The report goes to standard output, so every log line goes to
 * {@code System.err}: a single console appender replaces whatever
 * {@code logback.xml} installed. {@code json} selects Logback's
 * {@link JsonEncoder} for machine-read runs; any other format falls back to a
 * one-line text pattern and is reported once at WARN.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    /** Logger of the JDK HTTP client used for schema downloads. */
    static final String HTTP_CLIENT_LOGGER = "jdk.internal.httpclient.debug";

    private LogbackConfigurator() {
        // utility class
    }

    /** Configures logging from the resolved checker configuration. */
    public static void configure(CheckerConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * Configures logging.
     *
     * @param format {@code json} or {@code text}
     * @param level  root level name; unknown names mean INFO
     */
    static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));

        String normalized = format == null ? "text" : format.trim().toLowerCase(Locale.ROOT);
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoderFor(normalized, context));
        appender.start();
        root.addAppender(appender);

        context.getLogger(HTTP_CLIENT_LOGGER).setLevel(Level.WARN);

        if (!normalized.equals("json") && !normalized.equals("text")) {
            context.getLogger(LogbackConfigurator.class).warn("Unknown logging.format '{}', using text", format);
        }
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if (format.equals("json")) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
