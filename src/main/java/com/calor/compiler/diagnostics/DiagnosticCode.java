package com.calor.compiler.diagnostics;

/**
 * Stable diagnostic codes. The {@link #getCode() code} string is the contract with calling tools.
 */
public enum DiagnosticCode {
    // Lexer
    UNTERMINATED_STRING("unterminated_string", Stage.LEX, Severity.ERROR),
    UNKNOWN_TAG("unknown_tag", Stage.LEX, Severity.ERROR),
    UNEXPECTED_CHARACTER("unexpected_character", Stage.LEX, Severity.ERROR),

    // Parser
    UNEXPECTED_TOKEN("unexpected_token", Stage.PARSE, Severity.ERROR),
    ID_MISMATCH("id_mismatch", Stage.PARSE, Severity.ERROR),
    MISSING_REQUIRED_ATTRIBUTE("missing_required_attribute", Stage.PARSE, Severity.ERROR),
    MISSING_EXTENSION_SELF("missing_extension_self", Stage.PARSE, Severity.ERROR),
    INVALID_COMPARISON_MODE("invalid_comparison_mode", Stage.PARSE, Severity.ERROR),
    OPERATOR_ARGUMENT_COUNT("operator_argument_count", Stage.PARSE, Severity.ERROR),

    // Checker
    UNDEFINED_REFERENCE("undefined_reference", Stage.SEMANTIC, Severity.ERROR),
    TYPE_MISMATCH("type_mismatch", Stage.SEMANTIC, Severity.ERROR),
    REDECLARATION("redeclaration", Stage.SEMANTIC, Severity.ERROR),
    CONTRACT_SCOPE_VIOLATION("contract_scope_violation", Stage.SEMANTIC, Severity.ERROR),
    IMPLICIT_UNWRAP("implicit_unwrap", Stage.SEMANTIC, Severity.ERROR),
    DUPLICATE_ID("duplicate_id", Stage.SEMANTIC, Severity.ERROR),
    UNKNOWN_EFFECT("unknown_effect", Stage.SEMANTIC, Severity.WARNING),
    NON_EXHAUSTIVE_MATCH("non_exhaustive_match", Stage.SEMANTIC, Severity.WARNING),
    UNREACHABLE_PATTERN("unreachable_pattern", Stage.SEMANTIC, Severity.WARNING),

    // Emitters
    UNSUPPORTED_CONSTRUCT("unsupported_construct", Stage.EMISSION, Severity.ERROR),
    EMISSION_BLOCKED("emission_blocked", Stage.EMISSION, Severity.ERROR),

    INTERNAL_ERROR("internal_error", Stage.INTERNAL, Severity.ERROR);

    /**
     * Pipeline stage that owns the code.
     */
    public enum Stage {
        LEX,
        PARSE,
        SEMANTIC,
        EMISSION,
        INTERNAL
    }

    private final String code;
    private final Stage stage;
    private final Severity defaultSeverity;

    DiagnosticCode(String code, Stage stage, Severity defaultSeverity) {
        this.code = code;
        this.stage = stage;
        this.defaultSeverity = defaultSeverity;
    }

    public String getCode() {
        return code;
    }

    public Stage getStage() {
        return stage;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
