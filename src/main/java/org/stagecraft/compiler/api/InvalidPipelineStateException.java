package org.stagecraft.compiler.api;

/**
 * Thrown when a pipeline stage is invoked although its precondition state does not exist,
 * for example serializing a module that is still open or finalizing a module twice.
 * <p>
 * This signals an orchestration bug, not an error in the compiled sources. Source errors are
 * always reported as diagnostics.
 */
public class InvalidPipelineStateException extends IllegalStateException {

    private final String operation;

    /**
     * Constructs a new exception.
     * @param operation The stage operation that was rejected (e.g. {@code "serialize"}).
     * @param violatedPrecondition A description of the precondition that does not hold.
     */
    public InvalidPipelineStateException(String operation, String violatedPrecondition) {
        super(String.format("Cannot %s: %s", operation, violatedPrecondition));
        this.operation = operation;
    }

    /**
     * @return The rejected operation.
     */
    public String operation() {
        return operation;
    }
}
