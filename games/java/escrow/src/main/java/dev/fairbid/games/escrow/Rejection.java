package dev.fairbid.games.escrow;

import dev.fairbid.client.Errors;
import io.grpc.Status;

/**
 * Every reason an escrow command can be refused. Each maps to exactly one violated precondition.
 */
public enum Rejection {
    MISSING_CALLER(Status.Code.INVALID_ARGUMENT, "caller is required"),
    ALREADY_REGISTERED(Status.Code.FAILED_PRECONDITION, "Caller is already registered"),
    SESSION_FULL(Status.Code.FAILED_PRECONDITION, "Both player slots are taken"),
    SESSION_UNSETTLED(Status.Code.FAILED_PRECONDITION, "Previous session has not been settled"),
    WRONG_FEE_AMOUNT(Status.Code.INVALID_ARGUMENT, "Payment must equal the registration fee"),
    NOT_REGISTERED(Status.Code.FAILED_PRECONDITION, "Caller is not registered"),
    CANNOT_QUIT_NOW(Status.Code.FAILED_PRECONDITION, "Only a player waiting alone may quit"),
    OPPONENT_MISSING(Status.Code.FAILED_PRECONDITION, "No opponent has registered"),
    DUPLICATE_BID(Status.Code.FAILED_PRECONDITION, "Caller already placed a commitment"),
    MALFORMED_COMMITMENT(Status.Code.INVALID_ARGUMENT, "Commitment must be a 32-byte digest"),
    TIMED_OUT(Status.Code.FAILED_PRECONDITION, "Phase deadline has passed"),
    BIDS_INCOMPLETE(Status.Code.FAILED_PRECONDITION, "Both commitments must be placed before revealing"),
    INVALID_RANGE(Status.Code.INVALID_ARGUMENT, "Bid is outside the allowed range"),
    COMMITMENT_MISMATCH(Status.Code.FAILED_PRECONDITION, "Value and secret do not match the commitment"),
    ALREADY_REVEALED(Status.Code.FAILED_PRECONDITION, "Caller already revealed"),
    REVEAL_INCOMPLETE(Status.Code.FAILED_PRECONDITION, "Both bids must be revealed before withdrawing"),
    PHASE_NOT_EXPIRED(Status.Code.FAILED_PRECONDITION, "Phase deadline has not passed yet"),
    CANNOT_CLAIM_NOW(Status.Code.FAILED_PRECONDITION, "Opponent is not behind the caller"),
    NOBODY_TIMED_OUT(Status.Code.FAILED_PRECONDITION, "No player is stuck in the current phase"),
    NOT_ADMINISTRATOR(Status.Code.PERMISSION_DENIED, "Only the administrator may force-resolve");

    private final Status.Code statusCode;
    private final String message;

    Rejection(Status.Code statusCode, String message) {
        this.statusCode = statusCode;
        this.message = message;
    }

    public Status.Code statusCode() {
        return statusCode;
    }

    public Errors.CommandRejectedError error() {
        return new Errors.CommandRejectedError(name(), message, statusCode);
    }

    public Errors.CommandRejectedError error(String detail) {
        return new Errors.CommandRejectedError(name(), message + " (" + detail + ")", statusCode);
    }
}
