/*
 * CST-Lint - Lint Engine over a Lossless Concrete Syntax Tree
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.cstlint.ui;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.cstlint.core.ProcessingListener;
import net.boyechko.cstlint.core.ProcessingResult;
import net.boyechko.cstlint.fixes.FixException;
import net.boyechko.cstlint.fixes.FixOutcome;
import net.boyechko.cstlint.syntax.SourceException;
import net.boyechko.cstlint.validation.FileContext;
import net.boyechko.cstlint.validation.RuleFault;
import net.boyechko.cstlint.violation.Violation;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    private static final String CONSOLE_APPENDER_NAME = "CSTLINT_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.cstlint.processing");

    private final boolean showDiffs;

    public LoggingListener() {
        this(false);
    }

    /** @param showDiffs log a unified diff of every applied fix at INFO */
    public LoggingListener(boolean showDiffs) {
        this.showDiffs = showDiffs;
    }

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stdout. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-30logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onFileStart(FileContext file) {
        logger.debug("FILE {}", file);
    }

    @Override
    public void onSkipped(FileContext file) {
        logger.info("SKIPPED {}", file);
    }

    @Override
    public void onUnparseable(FileContext file, SourceException error) {
        logger.warn(
                "UNPARSEABLE {}:{}:{} {}", file, error.line(), error.column(), error.getMessage());
    }

    @Override
    public void onViolation(FileContext file, Violation violation) {
        logger.warn(
                "{}:{}:{} {} {}",
                file,
                violation.position().line(),
                violation.position().column(),
                violation.rule(),
                violation.message());
    }

    @Override
    public void onRuleFault(FileContext file, RuleFault fault) {
        logger.error("FAULT {} {}", file, fault.message());
    }

    @Override
    public void onFixApplied(FileContext file, FixOutcome outcome) {
        for (Violation v : outcome.applied()) {
            logger.info("FIXED {} {}: {}", file, v.rule(), v.resolutionNote());
        }
        if (showDiffs && outcome.changed()) {
            logger.info("{}", outcome.unifiedDiff(file.fileName()));
        }
    }

    @Override
    public void onFixError(FileContext file, FixException error) {
        logger.error("NOT FIXED {}: {}", file, error.getMessage());
    }

    @Override
    public void onSummary(ProcessingResult result) {
        logger.info(
                "SUMMARY {} {} detected={} resolved={} remaining={}",
                result.file(),
                result.outcome(),
                result.totalViolations(),
                result.totalResolved(),
                result.totalRemaining());
    }
}
