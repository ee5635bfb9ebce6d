package io.surfworks.meshforge.codegen;

/**
 * Thrown when a node cannot be turned into statements.
 *
 * <p>Every case is a violated contract between the graph builder, the rule
 * registry and the emitters, so code generation for the whole unit stops.
 */
public class EmissionException extends RuntimeException {

    private final ErrorCode errorCode;

    public EmissionException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public EmissionException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Emission error codes.
     */
    public enum ErrorCode {
        /** A value has no textual rendering */
        UNSUPPORTED_VALUE,

        /** No emission rule is registered for an operation signature */
        MISSING_RULE,

        /** An adapter reached emission without being pinned to exactly one device */
        PLACEMENT_PRECONDITION,

        /** A backward node has no forward counterpart */
        MISSING_MIRROR
    }
}
