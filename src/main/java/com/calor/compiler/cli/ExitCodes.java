package com.calor.compiler.cli;

/**
 * Process exit codes shared by every subcommand.
 */
final class ExitCodes {

    static final int SUCCESS = 0;
    static final int COMPILATION_ERRORS = 1;
    /** Invalid usage or I/O failure. */
    static final int USAGE = 2;

    private ExitCodes() {
    }
}
