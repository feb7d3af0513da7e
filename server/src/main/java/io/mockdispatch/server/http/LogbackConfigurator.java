package io.mockdispatch.server.http;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.mockdispatch.server.config.ServerConfig;
import java.util.UUID;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logging setup of the mock server and the request-id correlation that every log line carries.
 *
 * <p>
 * {@link #configure(ServerConfig)} installs a single console appender: Logback's
 * {@link JsonEncoder} for {@code logging.format: json} (MDC fields become JSON properties) or a
 * pattern with the request id for {@code text}. {@link #bindRequestId} and
 * {@link #unbindRequestId} bracket each HTTP exchange.
 */
public final class LogbackConfigurator {

    /** MDC key of the correlation id. */
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    static final String APPENDER_NAME = "STDOUT";

    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{" + REQUEST_ID_MDC_KEY + "}] - %msg%n";

    private LogbackConfigurator() {}

    public static void configure(ServerConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * Replaces the root appender and level. Jetty stays at WARN unless the root is stricter.
     *
     * @param format {@code json} or {@code text}
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        Level rootLevel = Level.toLevel(level, Level.INFO);

        root.setLevel(rootLevel);
        root.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder("json".equalsIgnoreCase(format) ? jsonEncoder(context) : textEncoder(context));
        appender.start();
        root.addAppender(appender);

        context.getLogger("org.eclipse.jetty").setLevel(rootLevel.isGreaterOrEqual(Level.WARN) ? null : Level.WARN);
    }

    /**
     * Puts the request id into the MDC, generating one when the caller sent none.
     *
     * @param incoming value of the request-id header, may be null or blank
     * @return the id now bound to the current thread
     */
    public static String bindRequestId(String incoming) {
        String requestId = incoming == null || incoming.isBlank() ? UUID.randomUUID().toString() : incoming.trim();
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        return requestId;
    }

    public static void unbindRequestId() {
        MDC.remove(REQUEST_ID_MDC_KEY);
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
