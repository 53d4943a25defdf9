package nl.nfi.djcyk.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

// file logging at DEBUG when LOG_DIRECTORY_PATH is set, otherwise warnings and errors on stderr
// registered through META-INF/services/ch.qos.logback.classic.spi.Configurator
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    public static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    private static final String LOG_FILE_NAME = "dj-cyk";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        setContext(loggerContext);

        final String logDirectoryPath = System.getProperty(LOG_DIRECTORY_PROPERTY);
        if (logDirectoryPath == null) {
            final Logger root = setupLogger("ROOT", "WARN", null);
            root.addAppender(createConsoleAppender());
            return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
        }

        final Logger root = setupLogger("ROOT", "DEBUG", null);
        root.addAppender(createFileAppender(logDirectoryPath));
        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createConsoleAppender() {
        final ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName("STDERR");
        appender.setTarget("System.err");
        appender.setEncoder(createEncoder(appender));
        appender.start();
        return appender;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logDirectoryPath + "/" + LOG_FILE_NAME + ".log");

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(logDirectoryPath + "/" + LOG_FILE_NAME + ".%d{yyyy-MM-dd}.%i.gz");
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(30);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);
        appender.setEncoder(createEncoder(appender));
        appender.start();
        return appender;
    }

    private PatternLayoutEncoder createEncoder(final Appender<ILoggingEvent> appender) {
        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();
        return layoutEncoder;
    }
}
