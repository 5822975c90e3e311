package com.namekis.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.LevelFilter;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.spi.FilterReply;

/**
 * Configures Logback from command line verbosity, replacing whatever logback.xml set up.
 *
 * <li>-q: errors only, on stderr.
 * <li>default (0), -v (1), -vv (2): INFO on stdout, WARN and ERROR on stderr.
 * <li>-vvv (3): DEBUG as well.
 * <li>-vvvv (4) and more: TRACE as well.
 *
 * With {@code debug} every line carries time, thread and caller; otherwise only the message is printed, so the
 * tree itself stays copy-pasteable.
 */
public class RichLogback {
    static final int LEVEL3_DEBUG = 3;
    static final int LEVEL4_TRACE = 4;
    private static final Logger log = LoggerFactory.getLogger(RichLogback.class);

    static final String SIMPLE_PATTERN = "%msg%n";
    static final String DETAILED_PATTERN = "%-10r/%d{HH:mm:ss.SSS} %-5level [%-15thread] %-40logger{36} - %msg - %C.%M\\(%F:%L\\)%n";

    public static void configureLogbackByVerbosity(String categories, int verbosity, boolean quiet, boolean color,
            boolean debug) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        String pattern = debug ? DETAILED_PATTERN : SIMPLE_PATTERN;
        if (color)
            pattern = pattern.replace("%msg", "%highlight(%msg)");
        Level level = levelFor(verbosity, quiet);

        ConsoleAppender<ILoggingEvent> out = appender(context, "System.out", pattern, color);
        ThresholdFilter outThreshold = new ThresholdFilter();
        outThreshold.setLevel(level.levelStr);
        outThreshold.start();
        out.addFilter(outThreshold);
        out.addFilter(deny(Level.WARN));
        out.addFilter(deny(Level.ERROR));
        out.start();

        ConsoleAppender<ILoggingEvent> err = appender(context, "System.err", pattern, color);
        ThresholdFilter errThreshold = new ThresholdFilter();
        errThreshold.setLevel(quiet ? "ERROR" : "WARN");
        errThreshold.start();
        err.addFilter(errThreshold);
        err.start();

        String names = categories == null || categories.isBlank() ? Logger.ROOT_LOGGER_NAME : categories;
        for (String category : names.split(",")) {
            ch.qos.logback.classic.Logger logger = context.getLogger(category.trim());
            logger.setLevel(level);
            logger.setAdditive(false);
            logger.addAppender(out);
            logger.addAppender(err);
            log.debug("Logback configured for {} at {} (verbosity {})", category.trim(), level, verbosity);
        }
    }

    static Level levelFor(int verbosity, boolean quiet) {
        if (quiet)
            return Level.ERROR;
        if (verbosity >= LEVEL4_TRACE)
            return Level.TRACE;
        if (verbosity == LEVEL3_DEBUG)
            return Level.DEBUG;
        return Level.INFO;
    }

    private static ConsoleAppender<ILoggingEvent> appender(LoggerContext context, String target, String pattern,
            boolean color) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(target);
        appender.setTarget(target);
        appender.setEncoder(encoder);
        appender.setWithJansi(color);
        return appender;
    }

    private static LevelFilter deny(Level level) {
        LevelFilter filter = new LevelFilter();
        filter.setLevel(level);
        filter.setOnMatch(FilterReply.DENY);
        filter.setOnMismatch(FilterReply.NEUTRAL);
        filter.start();
        return filter;
    }
}
