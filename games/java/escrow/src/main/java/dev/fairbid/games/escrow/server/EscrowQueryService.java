package dev.fairbid.games.escrow.server;

import dev.fairbid.EventBook;
import dev.fairbid.EventQueryGrpc;
import dev.fairbid.Query;
import dev.fairbid.games.escrow.EscrowSession;
import dev.fairbid.games.escrow.engine.SessionEngine;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

/**
 * Read access to the committed session history.
 */
public class EscrowQueryService extends EventQueryGrpc.EventQueryImplBase {

    private final SessionEngine engine;

    public EscrowQueryService(SessionEngine engine) {
        this.engine = engine;
    }

    @Override
    public void getEventBook(Query request, StreamObserver<EventBook> responseObserver) {
        if (request.hasCover() && !request.getCover().getDomain().isEmpty()
                && !EscrowSession.DOMAIN.equals(request.getCover().getDomain())) {
            responseObserver.onError(Status.NOT_FOUND
                .withDescription("Unknown domain: " + request.getCover().getDomain())
                .asRuntimeException());
            return;
        }
        responseObserver.onNext(engine.history(request.getLowerBound()));
        responseObserver.onCompleted();
    }
}
