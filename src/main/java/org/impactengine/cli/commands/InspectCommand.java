package org.impactengine.cli.commands;

import org.impactengine.cli.CommandLineInterface;
import org.impactengine.engine.JobResult;
import org.impactengine.engine.Manifest;
import org.impactengine.engine.ResultsLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "inspect",
    description = "Print the manifest and impact estimates of a completed job"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "JOB_DIR", description = "Job directory containing manifest.json")
    private Path jobDirectory;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            JobResult job = ResultsLoader.load(jobDirectory);
            Manifest manifest = job.manifest();
            out.println("Model:          " + manifest.modelType());
            out.println("Schema version: " + manifest.schemaVersion());
            out.println("Created at:     " + manifest.createdAt());
            out.println("Files:");
            for (Map.Entry<String, Manifest.FileEntry> file : manifest.files().entrySet()) {
                out.printf("  %-28s %-8s %s%n", file.getKey(), file.getValue().format(), file.getValue().path());
            }
            out.println("Impact estimates:");
            for (Map.Entry<String, Object> estimate : job.impactEstimates().entrySet()) {
                out.println("  " + estimate.getKey() + " = " + estimate.getValue());
            }
            return CommandLineInterface.EXIT_OK;
        } catch (IllegalStateException e) {
            err.println("Cannot inspect " + jobDirectory + ": " + e.getMessage());
            return CommandLineInterface.EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            err.println("Error reading job " + jobDirectory + ": " + e.getMessage());
            return CommandLineInterface.EXIT_PIPELINE_FAILURE;
        }
    }
}
