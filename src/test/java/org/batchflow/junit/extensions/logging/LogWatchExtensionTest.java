package org.batchflow.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.batchflow.junit.extensions.logging.LogLevel.ERROR;
import static org.batchflow.junit.extensions.logging.LogLevel.WARN;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionTest {

    private static final Logger log = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Test
    @ExpectLog(level = WARN, messagePattern = "disk .* is low")
    void expectedWarningIsMatchedOnTheFormattedMessage() {
        log.warn("disk {} is low", "sda");
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "retry", occurrences = 2)
    void expectedWarningCountsOccurrences() {
        log.warn("retry");
        log.warn("retry");
    }

    @Test
    @AllowLog(level = ERROR)
    void allowedLogIsNotRequired() {
        log.info("nothing to see");
    }

    @Test
    @FailOnLog(disabled = true)
    void disabledCheckAcceptsAnyWarning() {
        log.warn("undeclared warning");
    }
}
