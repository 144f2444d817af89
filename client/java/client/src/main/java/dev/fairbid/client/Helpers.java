package dev.fairbid.client;

import com.google.protobuf.Any;
import com.google.protobuf.Message;
import com.google.protobuf.Timestamp;
import dev.fairbid.Cover;
import dev.fairbid.EventBook;
import dev.fairbid.EventPage;

import java.time.Instant;
import java.util.List;

/**
 * Helper methods for working with command and event books.
 */
public final class Helpers {

    private static final String TYPE_URL_PREFIX = "type.googleapis.com/";

    private Helpers() {}

    /**
     * Get the domain from an EventBook.
     */
    public static String domain(EventBook book) {
        return book.hasCover() ? book.getCover().getDomain() : "";
    }

    /**
     * Calculate the next sequence number from an EventBook.
     */
    public static int nextSequence(EventBook book) {
        if (book == null || book.getPagesList().isEmpty()) {
            return 0;
        }
        return book.getPagesList().size();
    }

    /**
     * Extract the type name from a type URL.
     */
    public static String typeNameFromUrl(String typeUrl) {
        int idx = typeUrl.lastIndexOf('/');
        return idx >= 0 ? typeUrl.substring(idx + 1) : typeUrl;
    }

    /**
     * Extract the unqualified message name from a type URL,
     * e.g. "type.googleapis.com/fairbid.games.BidRevealed" becomes "BidRevealed".
     */
    public static String simpleTypeName(String typeUrl) {
        String name = typeNameFromUrl(typeUrl);
        int idx = name.lastIndexOf('.');
        return idx >= 0 ? name.substring(idx + 1) : name;
    }

    /**
     * Get the current timestamp as a protobuf Timestamp.
     */
    public static Timestamp now() {
        Instant now = Instant.now();
        return Timestamp.newBuilder()
            .setSeconds(now.getEpochSecond())
            .setNanos(now.getNano())
            .build();
    }

    /**
     * Pack a protobuf message into an Any.
     */
    public static Any packAny(Message message) {
        return Any.pack(message, TYPE_URL_PREFIX);
    }

    /**
     * Append pages to a book, renumbering them to follow the existing pages.
     */
    public static EventBook append(EventBook book, List<EventPage> pages) {
        var builder = book.toBuilder();
        int sequence = nextSequence(book);
        for (EventPage page : pages) {
            builder.addPages(page.toBuilder().setSequence(sequence++));
        }
        return builder.build();
    }

    /**
     * Create an empty EventBook for a domain.
     */
    public static EventBook emptyBook(String domain) {
        return EventBook.newBuilder()
            .setCover(Cover.newBuilder().setDomain(domain))
            .build();
    }
}
