package dev.fairbid.client;

import io.grpc.Status;

/**
 * Exception types for aggregate command handling.
 */
public class Errors {

    /**
     * Base exception for all framework errors.
     */
    public static class ClientError extends RuntimeException {
        public ClientError(String message) {
            super(message);
        }

        public ClientError(String message, Throwable cause) {
            super(message, cause);
        }

        /**
         * Returns true if this is a "precondition failed" error.
         */
        public boolean isPreconditionFailed() {
            return false;
        }

        /**
         * Returns true if this is an "invalid argument" error.
         */
        public boolean isInvalidArgument() {
            return false;
        }

        /**
         * Returns true if the operation was rolled back after it had been accepted.
         */
        public boolean isAborted() {
            return false;
        }

        /**
         * Convert to gRPC Status for RPC responses.
         */
        public Status toGrpcStatus() {
            return Status.INTERNAL.withDescription(getMessage());
        }
    }

    /**
     * Thrown when a command is rejected due to business rule violation.
     *
     * <p>Every rejection carries a machine-readable reason code and maps to a gRPC status code:
     * <ul>
     *   <li>{@link Status#FAILED_PRECONDITION} - State precondition not met (e.g., "SESSION_FULL")
     *   <li>{@link Status#INVALID_ARGUMENT} - Invalid command input (e.g., "INVALID_RANGE")
     *   <li>{@link Status#PERMISSION_DENIED} - Caller lacks the authority for the command
     * </ul>
     *
     * <p>Usage:
     * <pre>{@code
     * if (state.isFull()) {
     *     throw Errors.CommandRejectedError.preconditionFailed("SESSION_FULL", "Both slots are taken");
     * }
     * }</pre>
     */
    public static class CommandRejectedError extends ClientError {
        private final String reason;
        private final Status.Code statusCode;

        public CommandRejectedError(String reason, String message, Status.Code statusCode) {
            super(message);
            this.reason = reason;
            this.statusCode = statusCode;
        }

        public String getReason() {
            return reason;
        }

        public Status.Code getStatusCode() {
            return statusCode;
        }

        /**
         * Create a FAILED_PRECONDITION error for state precondition violations.
         */
        public static CommandRejectedError preconditionFailed(String reason, String message) {
            return new CommandRejectedError(reason, message, Status.Code.FAILED_PRECONDITION);
        }

        /**
         * Create an INVALID_ARGUMENT error for invalid command inputs.
         */
        public static CommandRejectedError invalidArgument(String reason, String message) {
            return new CommandRejectedError(reason, message, Status.Code.INVALID_ARGUMENT);
        }

        /**
         * Create a PERMISSION_DENIED error for callers without the required authority.
         */
        public static CommandRejectedError permissionDenied(String reason, String message) {
            return new CommandRejectedError(reason, message, Status.Code.PERMISSION_DENIED);
        }

        @Override
        public Status toGrpcStatus() {
            return Status.fromCode(statusCode).withDescription(reason + ": " + getMessage());
        }

        @Override
        public boolean isPreconditionFailed() {
            return statusCode == Status.Code.FAILED_PRECONDITION;
        }

        @Override
        public boolean isInvalidArgument() {
            return statusCode == Status.Code.INVALID_ARGUMENT;
        }
    }

    /**
     * Thrown when an accepted command could not be completed and its effects were rolled back.
     */
    public static class ExecutionAbortedError extends ClientError {
        public ExecutionAbortedError(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public boolean isAborted() {
            return true;
        }

        @Override
        public Status toGrpcStatus() {
            return Status.ABORTED.withDescription(getMessage());
        }
    }

    /**
     * Thrown when an invalid argument is provided.
     */
    public static class InvalidArgumentError extends ClientError {
        public InvalidArgumentError(String message) {
            super(message);
        }

        @Override
        public boolean isInvalidArgument() {
            return true;
        }

        @Override
        public Status toGrpcStatus() {
            return Status.INVALID_ARGUMENT.withDescription(getMessage());
        }
    }
}
