package com.calor.compiler.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code calor} command; does nothing on its own but list its subcommands.
 */
@Command(
        name = "calor",
        mixinStandardHelpOptions = true,
        version = "calor-compiler 1.0.0",
        description = "Compiles, checks and formats Calor sources.",
        subcommands = { CompileCommand.class, CheckCommand.class, FormatCommand.class }
)
public class CalorCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.USAGE;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new CalorCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
