package dev.fairbid.games.escrow.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAccountsTest {

    @Test
    void credits_accumulate_per_recipient() throws TransferFailedException {
        InMemoryAccounts accounts = new InMemoryAccounts();
        accounts.transfer("alice", 274);
        accounts.transfer("alice", 26);
        accounts.transfer("bob", 126);

        assertThat(accounts.balanceOf("alice")).isEqualTo(300);
        assertThat(accounts.balanceOf("carol")).isZero();
        assertThat(accounts.totalCredited()).isEqualTo(426);
    }

    @Test
    void refusing_recipients_fail_the_transfer() throws TransferFailedException {
        InMemoryAccounts accounts = new InMemoryAccounts();
        accounts.refuseTransfersTo("mallory");

        assertThatThrownBy(() -> accounts.transfer("mallory", 10))
            .isInstanceOf(TransferFailedException.class)
            .hasMessageContaining("mallory");
        assertThat(accounts.balanceOf("mallory")).isZero();

        accounts.acceptTransfersTo("mallory");
        accounts.transfer("mallory", 10);
        assertThat(accounts.balanceOf("mallory")).isEqualTo(10);
    }
}
