package dev.fairbid.games.escrow.server;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import dev.fairbid.BusinessCoordinatorGrpc;
import dev.fairbid.CommandBook;
import dev.fairbid.CommandResponse;
import dev.fairbid.EventBook;
import dev.fairbid.client.Errors;
import dev.fairbid.client.Helpers;
import dev.fairbid.games.ClaimOpponentTimeout;
import dev.fairbid.games.ForceResolve;
import dev.fairbid.games.PlaceCommitment;
import dev.fairbid.games.QuitSession;
import dev.fairbid.games.RegisterPlayer;
import dev.fairbid.games.RevealBid;
import dev.fairbid.games.WithdrawPayout;
import dev.fairbid.games.escrow.engine.SessionEngine;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC service implementation for escrow session commands.
 */
public class EscrowService extends BusinessCoordinatorGrpc.BusinessCoordinatorImplBase {
    private static final Logger logger = LoggerFactory.getLogger(EscrowService.class);

    private final SessionEngine engine;

    public EscrowService(SessionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void handle(CommandBook request, StreamObserver<CommandResponse> responseObserver) {
        try {
            EventBook events = processCommand(request);
            CommandResponse response = CommandResponse.newBuilder()
                .setEvents(events)
                .build();
            responseObserver.onNext(response);
            responseObserver.onCompleted();
        } catch (Errors.ClientError e) {
            responseObserver.onError(e.toGrpcStatus().asRuntimeException());
        } catch (InvalidProtocolBufferException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT
                .withDescription("Failed to parse command: " + e.getMessage())
                .asRuntimeException());
        } catch (Exception e) {
            logger.error("Unexpected error processing command", e);
            responseObserver.onError(Status.INTERNAL
                .withDescription("Internal error: " + e.getMessage())
                .asRuntimeException());
        }
    }

    private EventBook processCommand(CommandBook cmdBook) throws InvalidProtocolBufferException {
        if (cmdBook.getPagesList().isEmpty()) {
            throw new Errors.InvalidArgumentError("CommandBook has no pages");
        }

        var cmdPage = cmdBook.getPages(0);
        if (!cmdPage.hasCommand()) {
            throw new Errors.InvalidArgumentError("Command page has no command");
        }

        EventBook result = engine.execute(unpack(cmdPage.getCommand()));
        if (cmdBook.hasCover()) {
            return result.toBuilder()
                .setCover(result.getCover().toBuilder()
                    .setCorrelationId(cmdBook.getCover().getCorrelationId()))
                .build();
        }
        return result;
    }

    static Message unpack(Any command) throws InvalidProtocolBufferException {
        String typeName = Helpers.simpleTypeName(command.getTypeUrl());
        return switch (typeName) {
            case "RegisterPlayer" -> command.unpack(RegisterPlayer.class);
            case "QuitSession" -> command.unpack(QuitSession.class);
            case "PlaceCommitment" -> command.unpack(PlaceCommitment.class);
            case "RevealBid" -> command.unpack(RevealBid.class);
            case "WithdrawPayout" -> command.unpack(WithdrawPayout.class);
            case "ClaimOpponentTimeout" -> command.unpack(ClaimOpponentTimeout.class);
            case "ForceResolve" -> command.unpack(ForceResolve.class);
            default -> throw new Errors.InvalidArgumentError("Unknown command type: " + command.getTypeUrl());
        };
    }
}
