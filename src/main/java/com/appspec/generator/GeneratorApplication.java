package com.appspec.generator;

import com.appspec.generator.cli.AppSpecGenCommand;

import picocli.CommandLine;

/**
 * Main entry point: builds source trees for a target stack from an AppSpec IR document.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AppSpecGenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
