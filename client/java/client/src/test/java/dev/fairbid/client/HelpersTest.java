package dev.fairbid.client;

import com.google.protobuf.Any;
import dev.fairbid.Cover;
import dev.fairbid.EventBook;
import dev.fairbid.EventPage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HelpersTest {

    @Test
    void nextSequence_of_null_or_empty_book_is_zero() {
        assertThat(Helpers.nextSequence(null)).isZero();
        assertThat(Helpers.nextSequence(EventBook.getDefaultInstance())).isZero();
    }

    @Test
    void type_names_are_extracted_from_urls() {
        String url = "type.googleapis.com/fairbid.games.BidRevealed";
        assertThat(Helpers.typeNameFromUrl(url)).isEqualTo("fairbid.games.BidRevealed");
        assertThat(Helpers.simpleTypeName(url)).isEqualTo("BidRevealed");
        assertThat(Helpers.simpleTypeName("BidRevealed")).isEqualTo("BidRevealed");
    }

    @Test
    void packAny_uses_standard_prefix() {
        Any any = Helpers.packAny(Cover.newBuilder().setDomain("escrow").build());
        assertThat(any.getTypeUrl()).isEqualTo("type.googleapis.com/fairbid.Cover");
    }

    @Test
    void append_renumbers_pages_after_existing_ones() {
        EventBook book = Helpers.emptyBook("escrow").toBuilder()
            .addPages(EventPage.newBuilder().setSequence(0))
            .build();

        EventBook appended = Helpers.append(book, List.of(
            EventPage.newBuilder().setSequence(7).build(),
            EventPage.newBuilder().setSequence(7).build()));

        assertThat(appended.getPagesCount()).isEqualTo(3);
        assertThat(appended.getPages(1).getSequence()).isEqualTo(1);
        assertThat(appended.getPages(2).getSequence()).isEqualTo(2);
        assertThat(Helpers.domain(appended)).isEqualTo("escrow");
    }
}
