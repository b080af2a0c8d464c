package com.calor.compiler.diagnostics;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
