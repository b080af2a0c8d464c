package com.calor.compiler;

import com.calor.compiler.cli.CalorCommand;

/**
 * Main entry point for the Calor compiler CLI.
 */
public class CalorCompilerApplication {

    public static void main(String[] args) {
        int exitCode = CalorCommand.commandLine().execute(args);
        System.exit(exitCode);
    }
}
