package decentralabs.gmp.service.ledger;

import static decentralabs.gmp.support.TestAddresses.addr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.chain.ChainTransactionManager;
import decentralabs.gmp.util.Bytes32;

@DisplayName("TokenLedger Tests")
class TokenLedgerTest {

    private static final Bytes32 TOKEN = addr(0x7);
    private static final Bytes32 ALICE = addr(0xA1);
    private static final Bytes32 BOB = addr(0xB0);

    private ChainTransactionManager transactions;
    private TokenLedger ledger;

    @BeforeEach
    void setUp() {
        transactions = new ChainTransactionManager(1);
        ledger = new TokenLedger(transactions);
        transactions.execute(() -> ledger.mint(TOKEN, ALICE, BigInteger.valueOf(100)));
    }

    @Test
    @DisplayName("Should move balance between accounts")
    void shouldTransfer() {
        transactions.execute(() -> ledger.transfer(TOKEN, ALICE, BOB, 40));

        assertThat(ledger.balanceOf(TOKEN, ALICE)).isEqualTo(BigInteger.valueOf(60));
        assertThat(ledger.balanceOf(TOKEN, BOB)).isEqualTo(BigInteger.valueOf(40));
    }

    @Test
    @DisplayName("Should reject overdrafts without touching balances")
    void shouldRejectInsufficientBalance() {
        assertThatThrownBy(() -> transactions.execute(() -> ledger.transfer(TOKEN, ALICE, BOB, 101)))
            .isInstanceOf(GmpException.class)
            .extracting("code").isEqualTo(GmpErrorCode.INSUFFICIENT_BALANCE);

        assertThat(ledger.balanceOf(TOKEN, ALICE)).isEqualTo(BigInteger.valueOf(100));
        assertThat(ledger.balanceOf(TOKEN, BOB)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("Should undo transfers when the transaction rolls back")
    void shouldRollBackTransfers() {
        assertThatThrownBy(() -> transactions.execute(() -> {
            ledger.transfer(TOKEN, ALICE, BOB, 30);
            throw new IllegalStateException("handler failed");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(ledger.balanceOf(TOKEN, ALICE)).isEqualTo(BigInteger.valueOf(100));
        assertThat(ledger.balanceOf(TOKEN, BOB)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("Should keep balances separate per token")
    void shouldSeparateTokens() {
        assertThat(ledger.balanceOf(addr(0x8), ALICE)).isEqualTo(BigInteger.ZERO);
    }
}
