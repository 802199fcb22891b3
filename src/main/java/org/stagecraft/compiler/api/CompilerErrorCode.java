package org.stagecraft.compiler.api;

import org.stagecraft.compiler.diagnostics.Diagnostic;

/**
 * Defines unique, testable codes for all diagnostics the pipeline itself reports.
 * This decouples the test logic from the message texts.
 */
public enum CompilerErrorCode {
    // region Option Errors
    /** The output name override is blank or contains a path separator. */
    INVALID_OUTPUT_NAME("SC0001", Diagnostic.Severity.ERROR, "Invalid output name '%s'"),
    // endregion

    // region Declaration Binding Errors
    /** A type is declared twice in the same namespace. */
    DUPLICATE_TYPE("SC0101", Diagnostic.Severity.ERROR, "The namespace '%s' already contains a definition for '%s'"),
    /** A member name is used twice in the same type. */
    DUPLICATE_MEMBER("SC0102", Diagnostic.Severity.ERROR, "Type '%s' already defines a member called '%s'"),
    /** An import names a namespace that neither the sources nor the references declare. */
    UNKNOWN_NAMESPACE("SC0103", Diagnostic.Severity.ERROR, "The namespace '%s' does not exist"),
    /** A type name could not be resolved. */
    UNDECLARED_IDENTIFIER("SC0104", Diagnostic.Severity.ERROR, "The type or namespace name '%s' could not be found"),
    /** A simple type name is visible through more than one import. */
    AMBIGUOUS_REFERENCE("SC0105", Diagnostic.Severity.ERROR, "'%s' is an ambiguous reference between %s"),
    // endregion

    // region Method Compilation Errors
    /** A body instruction uses an unknown opcode. */
    UNKNOWN_OPCODE("SC0201", Diagnostic.Severity.ERROR, "Unknown opcode '%s'"),
    /** A body instruction has a missing or malformed operand. */
    INVALID_OPERAND("SC0202", Diagnostic.Severity.ERROR, "Invalid operand '%s' for %s"),
    /** LOAD_ARG refers to a parameter the method does not have. */
    ARGUMENT_INDEX_OUT_OF_RANGE("SC0203", Diagnostic.Severity.ERROR, "Argument index %s is out of range for method '%s'"),
    /** CALL names a member the target type does not declare. */
    MEMBER_NOT_FOUND("SC0204", Diagnostic.Severity.ERROR, "'%s' does not contain a definition for '%s'"),
    /** CALL names a private member of another type. */
    INACCESSIBLE_MEMBER("SC0205", Diagnostic.Severity.ERROR, "'%s.%s' is inaccessible due to its protection level"),
    /** A method body does not end with RET. */
    MISSING_RETURN("SC0206", Diagnostic.Severity.ERROR, "Not all code paths return a value in '%s'"),
    // endregion

    // region Analyzer Errors
    /** An analyzer threw an exception. */
    ANALYZER_FAILED("SC0301", Diagnostic.Severity.WARNING, "Analyzer '%s' threw an exception: %s"),
    // endregion

    // region Finalization Diagnostics
    /** Two manifest resources share a name. */
    DUPLICATE_RESOURCE("SC0401", Diagnostic.Severity.ERROR, "Resource identifier '%s' has already been used in this module"),
    /** An import contributed nothing to the compilation. */
    UNUSED_IMPORT("SC0402", Diagnostic.Severity.INFO, "Unnecessary import directive '%s'"),
    // endregion

    // region Serialization Errors
    /** Separate debug information was requested but no debug stream was supplied. */
    DEBUG_STREAM_MISSING("SC0501", Diagnostic.Severity.WARNING, "Debug information mode is SEPARATE but no debug stream was supplied"),
    /** Writing an output stream failed. */
    OUTPUT_WRITE_FAILED("SC0502", Diagnostic.Severity.ERROR, "An error occurred while writing the %s output: %s");
    // endregion

    private final String id;
    private final Diagnostic.Severity defaultSeverity;
    private final String messageFormat;

    CompilerErrorCode(String id, Diagnostic.Severity defaultSeverity, String messageFormat) {
        this.id = id;
        this.defaultSeverity = defaultSeverity;
        this.messageFormat = messageFormat;
    }

    /**
     * @return The stable diagnostic id, e.g. {@code SC0104}.
     */
    public String id() {
        return id;
    }

    /**
     * @return The severity diagnostics with this code are reported with.
     */
    public Diagnostic.Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * Formats the message of this code with the given arguments.
     * @param args The message arguments.
     * @return The formatted message.
     */
    public String format(Object... args) {
        return String.format(messageFormat, args);
    }
}
