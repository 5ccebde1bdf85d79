package com.augment.core;

import java.util.Objects;

/** A pipeline entry could not be built: unknown name, wrong number of arguments, or a bad value. */
public class OperationBuildException extends IllegalArgumentException {

    public enum Reason {
        UNRECOGNIZED_OPERATION,
        INVALID_ARGUMENT_COUNT,
        INVALID_ARGUMENT_VALUE
    }

    private final Reason reason;
    private final String operation;

    public OperationBuildException(Reason reason, String operation, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    public static OperationBuildException unrecognized(String operation) {
        return new OperationBuildException(Reason.UNRECOGNIZED_OPERATION, operation,
            "operation \"" + operation + "\" is not recognized");
    }

    public static OperationBuildException invalidCount(String operation, Arity expected, int received) {
        return new OperationBuildException(Reason.INVALID_ARGUMENT_COUNT, operation,
            operation + " takes " + expected + " argument(s), got " + received);
    }

    public static OperationBuildException invalidValue(String operation, String detail) {
        return new OperationBuildException(Reason.INVALID_ARGUMENT_VALUE, operation, operation + ": " + detail);
    }

    public Reason reason() { return reason; }

    public String operation() { return operation; }
}
