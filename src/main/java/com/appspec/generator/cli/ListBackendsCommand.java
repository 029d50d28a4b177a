package com.appspec.generator.cli;

import java.util.concurrent.Callable;

import com.appspec.generator.cli.output.BuildResultsPrinter;
import com.appspec.generator.codegen.BuildOrchestrator;
import com.appspec.generator.codegen.backend.BackendRegistry;
import com.appspec.generator.stacks.BuiltinStacks;

import picocli.CommandLine.Command;

@Command(
        name = "backends",
        mixinStandardHelpOptions = true,
        description = "Lists the available stacks with their generators and hooks."
)
public class ListBackendsCommand implements Callable<Integer> {

    private final BackendRegistry registry;

    public ListBackendsCommand() {
        this(BuiltinStacks.registry());
    }

    public ListBackendsCommand(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        new BuildResultsPrinter().printBackends(new BuildOrchestrator(registry).listBackends());
        return 0;
    }
}
