package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.TxDistribution;
import io.utxoledger.core.protocol.TxUndo;
import io.utxoledger.core.storage.InMemoryUtxoStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.utxoledger.core.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class BalancesViewTest {

    private final StakeholderId alice = ALICE.getStakeholderId();
    private final StakeholderId bob = BOB.getStakeholderId();
    private final StakeholderId carol = CAROL.getStakeholderId();

    @Test
    void emptyViewHasZeroTotal() {
        BalancesView view = BalancesView.empty();
        assertEquals(Coin.ZERO, view.total());
        assertEquals(Coin.ZERO, view.stakeOf(alice));
    }

    @Test
    void creditAndDebitMoveTotalInLockStep() {
        BalancesView view = BalancesView.empty();
        view.credit(alice, Coin.of(100));
        view.credit(bob, Coin.of(50));
        view.debit(alice, Coin.of(30));

        assertEquals(Coin.of(70), view.stakeOf(alice));
        assertEquals(Coin.of(50), view.stakeOf(bob));
        assertEquals(Coin.of(120), view.total());
    }

    @Test
    void debitBelowZeroIsRejected() {
        BalancesView view = BalancesView.empty();
        view.credit(alice, Coin.of(10));

        BalanceUnderflowException ex = assertThrows(BalanceUnderflowException.class,
                () -> view.debit(alice, Coin.of(11)));
        assertEquals(alice, ex.stakeholder());
        assertEquals(Coin.of(10), view.stakeOf(alice));
        assertEquals(Coin.of(10), view.total());
    }

    @Test
    void readsThroughToBaseUntilChanged() {
        InMemoryUtxoStore store = new InMemoryUtxoStore();
        fund(store, "a", ALICE, 40);
        BalancesView view = new BalancesView(store);

        assertEquals(Coin.of(40), view.stakeOf(alice));
        view.debit(alice, Coin.of(15));
        assertEquals(Coin.of(25), view.stakeOf(alice));
        assertEquals(Coin.of(25), view.total());
        assertEquals(Coin.of(40), store.stakeOf(alice).orElseThrow());
        assertEquals(Map.of(alice, Coin.of(25)), view.stakes());
    }

    @Test
    void applyTxMovesStakeUsingDistributionsAndRevertRestoresIt() {
        BalancesView view = BalancesView.empty();
        view.credit(alice, Coin.of(100));

        OutPoint point = new OutPoint(hashOf("x"), 0);
        Tx tx = spend(ALICE, point, out(BOB, 60), out(CAROL, 30));
        TxDistribution dist = new TxDistribution(List.of(
                Map.of(),
                Map.of(alice, Coin.of(10), carol, Coin.of(20))));
        TxAux aux = new TxAux(tx, dist);
        TxUndo undo = new TxUndo(List.of(outAux(ALICE, 100)));

        view.applyTx(aux, undo);

        assertEquals(Coin.of(10), view.stakeOf(alice));
        assertEquals(Coin.of(60), view.stakeOf(bob));
        assertEquals(Coin.of(20), view.stakeOf(carol));
        assertEquals(Coin.of(90), view.total());

        view.revertTx(aux, undo);
        assertEquals(Coin.of(100), view.stakeOf(alice));
        assertEquals(Coin.ZERO, view.stakeOf(bob));
        assertEquals(Coin.of(100), view.total());
    }

    @Test
    void failedApplyTxLeavesViewUnchanged() {
        BalancesView view = BalancesView.empty();
        view.credit(alice, Coin.of(5));
        Tx tx = spend(ALICE, new OutPoint(hashOf("y"), 0), out(BOB, 8));
        TxUndo undo = new TxUndo(List.of(outAux(ALICE, 10)));

        assertThrows(BalanceUnderflowException.class, () -> view.applyTx(new TxAux(tx), undo));
        assertEquals(Coin.of(5), view.stakeOf(alice));
        assertEquals(Coin.ZERO, view.stakeOf(bob));
        assertEquals(Coin.of(5), view.total());
    }
}
