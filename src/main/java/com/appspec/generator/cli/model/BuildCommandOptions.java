package com.appspec.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Options of the "build" command. No validation, no execution logic, no printing.
 */
@Getter
@Setter
public class BuildCommandOptions {

    @Option(names = {"--stack", "-s"}, required = true, description = "Target stack id (see the 'backends' command)")
    private String stack;

    @Option(names = {"--ir", "-i"}, required = true, description = "AppSpec IR document (JSON)")
    private Path irFile;

    @Option(names = {"--output-dir", "-o"}, description = "Output directory (defaults to current directory)")
    private Path outputDir;

    @Option(names = {"--target-version"}, defaultValue = "3", description = "Target toolchain version (default: 3)")
    private int targetVersion;

    @Option(names = {"--option"}, description = "Stack-specific option as key=value; repeatable")
    private Map<String, String> properties = new LinkedHashMap<>();

    @Option(names = {"--exclude-generator"}, description = "Generator id to leave out of the run; repeatable")
    private List<String> excludedGenerators = new ArrayList<>();

    @Option(names = {"--parallelism"}, defaultValue = "1", description = "Generators allowed to run at once (default: 1)")
    private int parallelism;

    @Option(names = {"--unit-timeout-ms"}, defaultValue = "0",
            description = "Time budget of each generator and hook in milliseconds; 0 means unbounded")
    private long unitTimeoutMillis;

    @Option(names = {"--clean-on-failure"}, description = "Delete the files a failed run already wrote")
    private boolean cleanOnFailure;
}
