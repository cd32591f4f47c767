package org.batchflow.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.batchflow.cli.CommandLineInterface;
import org.batchflow.pipeline.BatchPipeline;
import org.batchflow.pipeline.PipelineClosedException;
import org.batchflow.pipeline.PipelineConfig;
import org.batchflow.pipeline.api.contracts.Batch;
import org.batchflow.pipeline.api.resources.queues.QueueClosedException;
import org.batchflow.pipeline.observability.Slf4jObservationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Feeds newline-delimited items into a pipeline and prints every batch pulled from its supply.
 * <p>
 * Reads from {@code --input} or stdin. At end of input the pipeline is closed gracefully and the
 * command returns once every batch has been printed. A JVM shutdown hook closes the pipeline on
 * termination signals.
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Batches newline-delimited items from a file or stdin and prints each batch."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final String PIPELINE_PATH = "batchflow.pipeline";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input"}, description = "File with one item per line. Default: stdin")
    private File input;

    @Option(names = "--max-items", description = "Override batchflow.pipeline.maxItems")
    private Integer maxItems;

    @Option(names = "--max-wait-ms", description = "Override batchflow.pipeline.maxWaitMs")
    private Long maxWaitMs;

    @Option(names = "--workers", description = "Override batchflow.pipeline.workerPoolSize")
    private Integer workers;

    @Override
    public Integer call() throws Exception {
        final PipelineConfig pipelineConfig = PipelineConfig.fromConfig(resolvePipelineBlock());
        final BatchPipeline<String> pipeline = new BatchPipeline<>("batchflow", pipelineConfig, new Slf4jObservationSink());
        final PrintWriter out = spec.commandLine().getOut();

        final Thread shutdownHook = new Thread(pipeline::onTerminateRequested, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        pipeline.start();
        final Thread printer = new Thread(() -> printBatches(pipeline, out), "batchflow-supply");
        printer.start();

        long submitted = 0;
        try (BufferedReader reader = openInput()) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                pipeline.submit(line);
                submitted++;
            }
        } catch (PipelineClosedException e) {
            log.warn("Pipeline closed by a terminate request, remaining input is ignored");
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            log.debug("Input failure details:", e);
            pipeline.close();
            return 1;
        } finally {
            log.info("Submitted {} item(s), closing pipeline", submitted);
        }

        pipeline.close();
        while (!pipeline.awaitTermination(Duration.ofSeconds(1))) {
            log.debug("Waiting for the remaining batches to be pulled...");
        }
        printer.join();
        out.flush();

        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running or has run
            log.debug("Could not remove shutdown hook: {}", e.getMessage());
        }

        log.info("Done: {} batch(es), {} item(s) dropped",
            pipeline.getCounters().batchesDelivered(), pipeline.getCounters().droppedItems());
        return 0;
    }

    private Config resolvePipelineBlock() {
        final Config config = parent.getConfig();
        final Map<String, Object> overrides = new HashMap<>();
        if (maxItems != null) {
            overrides.put("maxItems", maxItems);
        }
        if (maxWaitMs != null) {
            overrides.put("maxWaitMs", maxWaitMs);
        }
        if (workers != null) {
            overrides.put("workerPoolSize", workers);
        }
        final Config block = config.hasPath(PIPELINE_PATH) ? config.getConfig(PIPELINE_PATH) : ConfigFactory.empty();
        return ConfigFactory.parseMap(overrides).withFallback(block);
    }

    private BufferedReader openInput() throws IOException {
        if (input != null) {
            return Files.newBufferedReader(input.toPath(), StandardCharsets.UTF_8);
        }
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    private static void printBatches(BatchPipeline<String> pipeline, PrintWriter out) {
        while (true) {
            final Batch<String> batch;
            try {
                batch = pipeline.requestSupply();
            } catch (QueueClosedException e) {
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            out.println(format(batch));
            out.flush();
        }
    }

    static String format(Batch<?> batch) {
        final List<Long> ids = batch.ids();
        return String.format("batch %d trigger=%s size=%d ids=%d-%d",
            batch.sequence(), batch.trigger(), batch.size(), ids.get(0), ids.get(ids.size() - 1));
    }
}
