package org.impactengine.cli.commands;

import com.typesafe.config.Config;
import org.impactengine.api.registry.ContractViolationException;
import org.impactengine.cli.CommandLineInterface;
import org.impactengine.config.ConfigProcessor;
import org.impactengine.config.ConfigurationException;
import org.impactengine.config.PipelineConfig;
import org.impactengine.engine.AdapterRegistries;
import org.impactengine.engine.EngineSettings;
import org.impactengine.engine.ImpactEngine;
import org.impactengine.engine.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Run the pipeline described by a YAML, JSON or HOCON file"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", paramLabel = "PIPELINE", description = "Pipeline configuration file")
    private Path pipelineFile;

    @Option(
        names = {"-s", "--storage"},
        description = "Storage root for job directories (default: impact-engine.storage.url)"
    )
    private String storageUrl;

    @Option(
        names = {"-j", "--job"},
        description = "Job identifier (default: generated from impact-engine.storage.job-prefix)"
    )
    private String jobId;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final ImpactEngine engine;
        final PipelineConfig pipeline;
        try {
            Config config = parent.getConfig();
            EngineSettings settings = EngineSettings.from(config);
            if (storageUrl != null) {
                settings = settings.withStorageUrl(storageUrl);
            }
            ConfigProcessor processor = new ConfigProcessor();
            engine = new ImpactEngine(settings, AdapterRegistries.forApplication(config), processor);
            pipeline = processor.process(pipelineFile);
        } catch (ConfigurationException | ContractViolationException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_CONFIG_ERROR;
        }

        try {
            RunResult result = engine.run(pipeline, jobId);
            out.println("Job:     " + result.jobId());
            out.println("Results: " + result.resultsPath());
            for (Map.Entry<String, Object> estimate : result.fit().result().getImpactEstimates().entrySet()) {
                out.println("  " + estimate.getKey() + " = " + estimate.getValue());
            }
            return CommandLineInterface.EXIT_OK;
        } catch (Exception e) {
            log.error("Pipeline failed: {}", e.getMessage(), e);
            err.println("Pipeline failed: " + e.getMessage());
            return CommandLineInterface.EXIT_PIPELINE_FAILURE;
        }
    }
}
