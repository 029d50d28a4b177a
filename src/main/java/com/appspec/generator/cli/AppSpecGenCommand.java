package com.appspec.generator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "appspec-gen",
        mixinStandardHelpOptions = true,
        version = "appspec-gen 1.0.0",
        description = "Generates source trees for a target stack from an AppSpec IR document.",
        subcommands = {BuildCommand.class, ListBackendsCommand.class, CommandLine.HelpCommand.class}
)
public class AppSpecGenCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
