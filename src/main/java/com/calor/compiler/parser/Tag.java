package com.calor.compiler.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Section markers recognised after the {@code §} sigil.
 *
 * {@code closing} is the name used after {@code §/} when the tag has a closing
 * counterpart, and {@code requiresClose} marks tags whose closing tag is mandatory.
 */
public enum Tag {
    MODULE("M", "M", true),
    USING("U"),
    FUNCTION("F", "F", true),
    ASYNC_FUNCTION("AF", "AF", true),
    INPUT("I"),
    OUTPUT("O"),
    EFFECTS("E"),
    REQUIRES("Q"),
    ENSURES("S"),
    INVARIANT("IV"),
    CLASS("CL", "CL", true),
    EXTENDS("EXT"),
    IMPLEMENTS("IMPL"),
    FIELD("FLD"),
    PROPERTY("PROP", "PROP", true),
    GET("GET", "GET", false),
    SET("SET", "SET", false),
    INIT("INIT"),
    CONSTRUCTOR("CTOR", "CTOR", true),
    BASE("BASE", "BASE", false),
    THIS("THIS", "THIS", false),
    METHOD("MT", "MT", true),
    ASYNC_METHOD("AMT", "AMT", true),
    EVENT("EVT"),
    INTERFACE("IFACE", "IFACE", true),
    ENUM("EN", "EN", true),
    ENUM_EXTENSION("EEXT", "EEXT", true),
    RECORD("D", "D", true),
    RECORD_FIELD("FL"),
    UNION("T", "T", true),
    VARIANT("V"),
    DELEGATE("DEL", "DEL", true),
    BIND("B"),
    ASSIGN("ASSIGN"),
    RETURN("R"),
    IF("IF", "I", true),
    ELSE_IF("EI"),
    ELSE("EL"),
    FOR("L", "L", true),
    WHILE("WH", "WH", true),
    DO("DO", "DO", true),
    FOREACH("EACH", "EACH", true),
    TRY("TR", "TR", true),
    CATCH("CA"),
    FINALLY("FI"),
    THROW("TH"),
    RETHROW("RT"),
    BREAK("BK"),
    CONTINUE("CN"),
    PRINT("P"),
    PRINT_INLINE("Pf"),
    PUSH("PUSH"),
    PUT("PUT"),
    REMOVE("REM"),
    SET_INDEX("SETIDX"),
    CLEAR("CLR"),
    INSERT("INS"),
    MATCH("W", "W", true),
    CASE("K", "K", false),
    WHEN("WHEN"),
    USE("USE", "USE", true),
    CALL("C", "C", true),
    ARG("A"),
    NEW("NEW", "NEW", true),
    AWAIT("AWAIT"),
    LAMBDA("LAM", "LAM", true),
    SOME("SM"),
    NONE("NN"),
    OK("OK"),
    ERR("ERR"),
    VAR("VAR"),
    RELATIONAL_PATTERN("PREL"),
    PROPERTY_PATTERN("PPROP"),
    PROPERTY_MATCH("PMATCH"),
    POSITIONAL_PATTERN("PPOS"),
    LIST_PATTERN("PLIST"),
    REST("REST");

    private static final Map<String, Tag> BY_NAME = new HashMap<>();
    private static final Map<String, Tag> BY_CLOSING_NAME = new HashMap<>();

    static {
        for (Tag tag : values()) {
            BY_NAME.put(tag.name, tag);
            if (tag.closingName != null) {
                BY_CLOSING_NAME.put(tag.closingName, tag);
            }
        }
    }

    private final String name;
    private final String closingName;
    private final boolean requiresClose;

    Tag(String name) {
        this(name, null, false);
    }

    Tag(String name, String closingName, boolean requiresClose) {
        this.name = name;
        this.closingName = closingName;
        this.requiresClose = requiresClose;
    }

    public String getName() {
        return name;
    }

    public String getClosingName() {
        return closingName;
    }

    public boolean isRequiresClose() {
        return requiresClose;
    }

    public static Tag fromName(String name) {
        return BY_NAME.get(name);
    }

    public static Tag fromClosingName(String name) {
        return BY_CLOSING_NAME.get(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(BY_NAME.keySet());
    }

    public static Set<String> closingNames() {
        return Collections.unmodifiableSet(BY_CLOSING_NAME.keySet());
    }
}
