package io.griddedetl.era5.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Attaches log files to the running Logback context: one per task, receiving only events logged
 * while that task's id is in the MDC of the logging thread, and one per run receiving everything.
 * Without Logback as the SLF4J backend the handles do nothing.
 */
public final class TaskLogs {
    public static final String MDC_KEY = "etl.task";
    static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss} - %thread - %level - %logger{0} - %msg%n";

    private TaskLogs() {}

    /**
     * Opens {@code file} for the task {@code taskId} and binds the id to the calling thread until
     * the handle is closed.
     */
    public static Handle task(String taskId, Path file) {
        Objects.requireNonNull(taskId, "taskId");
        MDC.put(MDC_KEY, taskId);
        FileAppender<ILoggingEvent> appender = attach("task-" + taskId, file, new TaskFilter(taskId));
        return () -> {
            detach(appender);
            MDC.remove(MDC_KEY);
        };
    }

    /** Everything logged until the handle is closed, from any thread. */
    public static Handle run(Path file) {
        FileAppender<ILoggingEvent> appender = attach("run-" + file.getFileName(), file, null);
        return () -> detach(appender);
    }

    private static FileAppender<ILoggingEvent> attach(String name, Path file, Filter<ILoggingEvent> filter) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) return null;

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(name);
        appender.setFile(file.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        if (filter != null) {
            filter.setContext(context);
            filter.start();
            appender.addFilter(filter);
        }
        appender.start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
        return appender;
    }

    private static void detach(FileAppender<ILoggingEvent> appender) {
        if (appender == null) return;
        LoggerContext context = (LoggerContext) appender.getContext();
        context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(appender);
        appender.stop();
    }

    /** Closes the log file; never throws. */
    @FunctionalInterface
    public interface Handle extends AutoCloseable {
        @Override
        void close();
    }

    static final class TaskFilter extends Filter<ILoggingEvent> {
        private final String taskId;

        TaskFilter(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public FilterReply decide(ILoggingEvent event) {
            return taskId.equals(event.getMDCPropertyMap().get(MDC_KEY)) ? FilterReply.NEUTRAL : FilterReply.DENY;
        }
    }
}
