package dev.fairbid.games.escrow.projector;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.protobuf.Any;
import com.google.protobuf.ByteString;
import dev.fairbid.EventBook;
import dev.fairbid.EventPage;
import dev.fairbid.client.Helpers;
import dev.fairbid.games.Payout;
import dev.fairbid.games.PayoutRedirected;
import dev.fairbid.games.PlayerRegistered;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultEscrowLogProjectorTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(DefaultEscrowLogProjector.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final EscrowLogProjector projector = new DefaultEscrowLogProjector();

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private static List<String> fields(ILoggingEvent event) {
        return Arrays.stream(event.getArgumentArray()).map(String::valueOf).toList();
    }

    @Test
    void logs_one_line_per_event() {
        EventBook book = Helpers.append(Helpers.emptyBook("escrow"), List.of(
            EventPage.newBuilder()
                .setEvent(Helpers.packAny(PlayerRegistered.newBuilder()
                    .setPlayer("alice").setFee(200).setBank(200).build()))
                .build(),
            EventPage.newBuilder()
                .setEvent(Helpers.packAny(PayoutRedirected.newBuilder()
                    .setIntendedRecipient("alice")
                    .setPayout(Payout.newBuilder().setRecipient("admin").setAmount(400))
                    .build()))
                .build()));

        projector.logEvents(book);

        assertThat(appender.list).hasSize(2);
        assertThat(fields(appender.list.get(0)))
            .contains("domain=escrow", "sequence=0", "event_type=PlayerRegistered", "player=alice", "amount=200");
        assertThat(fields(appender.list.get(1)))
            .contains("sequence=1", "intended_recipient=alice", "recipient=admin", "amount=400");
    }

    @Test
    void undecodable_events_are_warned_about() {
        EventBook book = Helpers.emptyBook("escrow").toBuilder()
            .addPages(EventPage.newBuilder().setEvent(Any.newBuilder()
                .setTypeUrl("type.googleapis.com/fairbid.games.BidRevealed")
                .setValue(ByteString.copyFrom(new byte[] {(byte) 0xFF, (byte) 0xFF}))))
            .build();

        projector.logEvents(book);

        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void empty_books_are_ignored() {
        projector.logEvents(EventBook.getDefaultInstance());
        projector.logEvents(null);

        assertThat(appender.list).isEmpty();
    }
}
