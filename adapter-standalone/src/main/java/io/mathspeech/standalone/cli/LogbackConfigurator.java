package io.mathspeech.standalone.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.mathspeech.standalone.config.ConverterConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of {@link ConverterConfig} to Logback.
 *
 * <p>
 * Output always goes to standard error so standard output carries only converted speech. The
 * root level, the format (JSON lines or a text pattern) and the rewrite trace all come from the
 * configuration. Until this runs, Logback's classpath defaults apply.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "math-speech-stderr";

    /** Logger that reports each applied pattern at DEBUG. */
    static final String REWRITE_LOGGER = "io.mathspeech.core.engine";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root logger's appenders with one stderr appender built from {@code config}.
     * Safe to call repeatedly; the previous appender is stopped.
     */
    public static void configure(ConverterConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.valueOf(config.rootLogLevel()));

        // null makes the engine logger inherit the root level again
        context.getLogger(REWRITE_LOGGER).setLevel(config.loggingRewriteTrace() ? Level.DEBUG : null);

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(config.jsonLogging() ? jsonEncoder(context) : textEncoder(context, config.loggingPattern()));
        appender.start();
        root.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();
        return encoder;
    }
}
