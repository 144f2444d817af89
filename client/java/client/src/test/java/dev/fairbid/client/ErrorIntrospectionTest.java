package dev.fairbid.client;

import io.grpc.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for error introspection methods.
 *
 * Error introspection allows callers to check the nature of errors
 * without type casting or exception handling boilerplate.
 */
class ErrorIntrospectionTest {

    // =========================================================================
    // isPreconditionFailed Tests
    // =========================================================================

    @Test
    void commandRejectedError_preconditionFailed_should_return_true_for_isPreconditionFailed() {
        var error = Errors.CommandRejectedError.preconditionFailed("SESSION_FULL", "full");
        assertThat(error.isPreconditionFailed()).isTrue();
        assertThat(error.isInvalidArgument()).isFalse();
    }

    @Test
    void commandRejectedError_permissionDenied_is_neither_precondition_nor_argument() {
        var error = Errors.CommandRejectedError.permissionDenied("NOT_ADMINISTRATOR", "nope");
        assertThat(error.isPreconditionFailed()).isFalse();
        assertThat(error.isInvalidArgument()).isFalse();
        assertThat(error.getStatusCode()).isEqualTo(Status.Code.PERMISSION_DENIED);
    }

    // =========================================================================
    // isInvalidArgument Tests
    // =========================================================================

    @Test
    void commandRejectedError_invalidArgument_should_return_true_for_isInvalidArgument() {
        var error = Errors.CommandRejectedError.invalidArgument("INVALID_RANGE", "bad bid");
        assertThat(error.isInvalidArgument()).isTrue();
    }

    @Test
    void invalidArgumentError_should_return_true_for_isInvalidArgument() {
        var error = new Errors.InvalidArgumentError("bad input");
        assertThat(error.isInvalidArgument()).isTrue();
    }

    @Test
    void clientError_should_return_false_for_everything() {
        var error = new Errors.ClientError("boom");
        assertThat(error.isPreconditionFailed()).isFalse();
        assertThat(error.isInvalidArgument()).isFalse();
        assertThat(error.isAborted()).isFalse();
    }

    // =========================================================================
    // isAborted Tests
    // =========================================================================

    @Test
    void executionAbortedError_should_return_true_for_isAborted() {
        var error = new Errors.ExecutionAbortedError("rolled back", new IllegalStateException("cause"));
        assertThat(error.isAborted()).isTrue();
        assertThat(error.getCause()).hasMessage("cause");
    }

    // =========================================================================
    // toGrpcStatus Tests
    // =========================================================================

    @Test
    void commandRejectedError_status_carries_reason_and_message() {
        var status = Errors.CommandRejectedError.preconditionFailed("TIMED_OUT", "deadline passed")
            .toGrpcStatus();
        assertThat(status.getCode()).isEqualTo(Status.Code.FAILED_PRECONDITION);
        assertThat(status.getDescription()).isEqualTo("TIMED_OUT: deadline passed");
    }

    @Test
    void executionAbortedError_maps_to_ABORTED() {
        var status = new Errors.ExecutionAbortedError("transfer failed", null).toGrpcStatus();
        assertThat(status.getCode()).isEqualTo(Status.Code.ABORTED);
    }

    @Test
    void plain_clientError_maps_to_INTERNAL() {
        assertThat(new Errors.ClientError("oops").toGrpcStatus().getCode())
            .isEqualTo(Status.Code.INTERNAL);
    }
}
