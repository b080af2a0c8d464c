package com.calor.compiler.codegen.calor;

import com.calor.compiler.codegen.IdCounter;

import lombok.Getter;

/**
 * Per-call state of one Calor emission.
 */
@Getter
public class CalorEmitContext {

    private final IdCounter ids;

    public CalorEmitContext(IdCounter ids) {
        this.ids = ids;
    }

    public CalorEmitContext() {
        this(new IdCounter());
    }
}
