package org.batchflow.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.batchflow.config.LoggingConfigurator;
import org.batchflow.junit.extensions.logging.AllowLog;
import org.batchflow.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.batchflow.junit.extensions.logging.LogLevel.WARN;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = WARN, loggerPattern = "org\\.batchflow\\.pipeline\\.observations")
class CommandLineInterfaceTest {

    private static final Pattern BATCH_LINE =
        Pattern.compile("batch (\\d+) trigger=(COUNT|TIME|DRAIN) size=(\\d+) ids=(\\d+)-(\\d+)");

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    // Running a command applies the logging block of reference.conf
    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.batchflow.pipeline.observations").setLevel(null);
        LoggingConfigurator.reset();
    }

    private CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd;
    }

    @Test
    void commandNameAndSubcommands() {
        CommandLine cmd = commandLine();

        assertThat(cmd.getCommandName()).isEqualTo("batchflow");
        assertThat(cmd.getSubcommands()).containsKeys("run", "help");
    }

    @Test
    @Timeout(20)
    void runBatchesEveryInputLine() throws IOException {
        Path input = tempDir.resolve("items.txt");
        List<String> lines = IntStream.rangeClosed(1, 7).mapToObj(i -> "item-" + i).collect(Collectors.toList());
        lines.add(3, "");
        Files.write(input, lines);
        Path config = tempDir.resolve("batchflow.conf");
        Files.writeString(config, "batchflow.pipeline.stopTimeoutMs = 2000\n");

        int exitCode = commandLine().execute(
            "--config", config.toString(),
            "run", "--input", input.toString(), "--max-items", "3", "--max-wait-ms", "5000", "--workers", "2");

        assertThat(exitCode).isZero();
        List<String> output = Arrays.stream(out.toString().split("\\R")).filter(l -> !l.isBlank()).collect(Collectors.toList());
        assertThat(output).hasSize(3).allMatch(l -> BATCH_LINE.matcher(l).matches());
        int total = 0;
        for (String line : output) {
            Matcher matcher = BATCH_LINE.matcher(line);
            assertThat(matcher.matches()).isTrue();
            int size = Integer.parseInt(matcher.group(3));
            assertThat(size).isBetween(1, 3);
            assertThat(Long.parseLong(matcher.group(5)) - Long.parseLong(matcher.group(4)) + 1).isEqualTo(size);
            total += size;
        }
        assertThat(total).isEqualTo(7);
    }

    @Test
    void missingConfigFileFails() {
        int exitCode = commandLine().execute("--config", tempDir.resolve("missing.conf").toString(), "run");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
