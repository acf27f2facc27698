/*
 * Markup-Rewrite - Document Tree Rewrite Engine
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
package net.boyechko.markup.rewrite.core;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.markup.rewrite.issues.Issue;
import net.boyechko.markup.rewrite.issues.IssueList;
import net.boyechko.markup.rewrite.issues.IssueSev;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Reports processing progress through SLF4J. Phases, successes and the summary are logged at
 * info, issues at the level matching their severity, tree dumps at debug.
 */
public class LoggingListener implements ProcessingListener {

    static final String LOGGER_NAME = "net.boyechko.markup.rewrite.processing";

    static final String CONSOLE_APPENDER_NAME = "MARKUP_REWRITE_CONSOLE";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    /**
     * Creates a listener whose events are printed to stdout. Only the processing logger writes
     * there; diagnostics of the rewrite rules keep going to the configured appenders.
     */
    public static LoggingListener withConsoleOutput() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger processing = ctx.getLogger(LOGGER_NAME);
        if (processing.getAppender(CONSOLE_APPENDER_NAME) == null) {
            processing.addAppender(stdout(ctx));
            processing.setAdditive(false);
        }
        return new LoggingListener();
    }

    private static ConsoleAppender<ILoggingEvent> stdout(LoggerContext ctx) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("[%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setName(CONSOLE_APPENDER_NAME);
        appender.setContext(ctx);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    private static Level levelOf(IssueSev severity) {
        switch (severity) {
            case INFO:
                return Level.INFO;
            case WARNING:
                return Level.WARN;
            default:
                return Level.ERROR;
        }
    }

    private static String describe(Issue issue) {
        String location = issue.where().toString();
        String suffix = location.isEmpty() ? "" : " at " + location;
        return "ISSUE " + issue.type() + ": " + issue.message() + suffix;
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        logger.atLevel(levelOf(issue.severity())).log(describe(issue));
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        logger.warn("ISSUES {} {}", issues.size(), groupLabel);
        issues.forEach(this::onWarning);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onSummary(IssueList allIssues) {
        int errors = allIssues.atLeast(IssueSev.ERROR).size();
        int warnings = allIssues.atLeast(IssueSev.WARNING).size() - errors;
        logger.info(
                "SUMMARY issues={} errors={} warnings={}", allIssues.size(), errors, warnings);
    }
}
