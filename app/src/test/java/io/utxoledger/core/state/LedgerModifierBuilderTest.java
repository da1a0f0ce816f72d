package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.TxDistribution;
import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOut;
import io.utxoledger.core.storage.InMemoryUtxoStore;
import io.utxoledger.core.validation.TxVerifier;
import io.utxoledger.core.validation.VerificationResult;
import io.utxoledger.core.validation.Violation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.utxoledger.core.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LedgerModifierBuilderTest {

    private InMemoryUtxoStore store;
    private LedgerModifierBuilder builder;
    private OutPoint aliceCoin;
    private Tx first;
    private Tx second;
    private Tx third;

    @BeforeEach
    void setUp() {
        store = new InMemoryUtxoStore();
        builder = new LedgerModifierBuilder(store, new TxVerifier());
        aliceCoin = fund(store, "alice", ALICE, 100);
        first = spend(ALICE, aliceCoin, out(BOB, 60), out(ALICE, 40));
        second = spend(BOB, new OutPoint(first.id(), 0), out(CAROL, 50));
        third = spend(CAROL, new OutPoint(second.id(), 0), out(ALICE, 45));
    }

    @Test
    void buildsDiffForDependentBatchInAnyOrder() {
        VerificationResult<LedgerModifier> result = builder.build(List.of(aux(third), aux(first), aux(second)));

        assertTrue(result.ok, result::toString);
        LedgerModifier modifier = result.value;
        UtxoModifier utxo = modifier.utxoModifier();

        assertEquals(Optional.empty(), utxo.resolve(store, aliceCoin));
        assertEquals(Optional.empty(), utxo.resolve(store, new OutPoint(first.id(), 0)));
        assertEquals(Optional.of(outAux(ALICE, 40)), utxo.resolve(store, new OutPoint(first.id(), 1)));
        assertEquals(Optional.of(outAux(ALICE, 45)), utxo.resolve(store, new OutPoint(third.id(), 0)));

        assertEquals(Coin.of(85), modifier.balances().stakeOf(ALICE.getStakeholderId()));
        assertEquals(Coin.ZERO, modifier.balances().stakeOf(BOB.getStakeholderId()));
        assertEquals(Coin.ZERO, modifier.balances().stakeOf(CAROL.getStakeholderId()));
        assertEquals(Coin.of(85), modifier.balances().total());

        assertEquals(3, modifier.undos().size());
        assertEquals(List.of(outAux(ALICE, 100)), modifier.undos().get(first.id()).orElseThrow().spent());
        assertEquals(List.of(outAux(BOB, 60)), modifier.undos().get(second.id()).orElseThrow().spent());
        assertEquals(3, modifier.memPool().size());

        // nothing reached the store
        assertEquals(1, store.size());
        assertEquals(Coin.of(100), store.totalStake());
    }

    @Test
    void failingMemberAbortsWholeBatch() {
        Tx overspend = spend(ALICE, new OutPoint(first.id(), 1), out(BOB, 41));

        VerificationResult<LedgerModifier> result = builder.build(List.of(aux(first), aux(second), aux(overspend)));

        assertFalse(result.ok);
        assertNull(result.value);
        assertEquals(EnumSet.of(Violation.Kind.INSUFFICIENT_VALUE), result.kinds());
    }

    @Test
    void conflictingSpendsInOneBatchAreRejected() {
        Tx rival = spend(ALICE, aliceCoin, out(CAROL, 100));

        VerificationResult<LedgerModifier> result = builder.build(List.of(aux(first), aux(rival)));

        assertEquals(EnumSet.of(Violation.Kind.UNRESOLVED_INPUT), result.kinds());
    }

    @Test
    void spendingTheSameOutputTwiceInOneTxIsRejected() {
        List<TxOut> outs = List.of(out(BOB, 150));
        TxIn in = ALICE.signInput(aliceCoin, outs);
        Tx twice = new Tx(List.of(in, in), outs);

        VerificationResult<LedgerModifier> result = builder.build(List.of(aux(twice)));

        assertEquals(EnumSet.of(Violation.Kind.DUPLICATE_INPUT), result.kinds());
    }

    @Test
    void distributionLargerThanItsOutputIsRejected() {
        Tx tx = spend(ALICE, aliceCoin, out(BOB, 40));
        TxDistribution inflated = new TxDistribution(List.of(Map.of(CAROL.getStakeholderId(), Coin.of(1_000_000))));

        VerificationResult<LedgerModifier> result = builder.build(List.of(new TxAux(tx, inflated)));

        assertEquals(EnumSet.of(Violation.Kind.BAD_DISTRIBUTION), result.kinds());
        assertEquals(0, result.violations.iterator().next().index);
        assertEquals(Coin.of(100), store.totalStake());
    }

    @Test
    void oversizedDistributionsFailInsteadOfOverflowing() {
        Tx tx = spend(ALICE, aliceCoin, out(BOB, 40), out(BOB, 40));
        TxDistribution huge = new TxDistribution(List.of(
                Map.of(CAROL.getStakeholderId(), Coin.MAX),
                Map.of(CAROL.getStakeholderId(), Coin.MAX)));

        VerificationResult<LedgerModifier> result = builder.build(List.of(new TxAux(tx, huge)));

        assertFalse(result.ok);
        assertEquals(EnumSet.of(Violation.Kind.BAD_DISTRIBUTION), result.kinds());
        assertEquals(2, result.violations.size());
    }

    @Test
    void exactDistributionSplitsStake() {
        Tx tx = spend(ALICE, aliceCoin, out(BOB, 40));
        TxDistribution split = new TxDistribution(List.of(
                Map.of(BOB.getStakeholderId(), Coin.of(10), CAROL.getStakeholderId(), Coin.of(30))));

        VerificationResult<LedgerModifier> result = builder.build(List.of(new TxAux(tx, split)));

        assertTrue(result.ok, result::toString);
        assertEquals(Coin.of(30), result.value.balances().stakeOf(CAROL.getStakeholderId()));
        assertEquals(Coin.of(40), result.value.balances().total());
    }

    @Test
    void applyToLeavesTargetUnchangedOnFailure() {
        LedgerModifier target = LedgerModifier.empty(store);
        Tx bad = spend(BOB, aliceCoin, out(BOB, 100));

        assertFalse(builder.applyTo(target, aux(bad)).ok);

        assertTrue(target.utxoModifier().isEmpty());
        assertEquals(0, target.memPool().size());
        assertEquals(0, target.undos().size());
        assertEquals(Coin.of(100), target.balances().total());
    }

    @Test
    void committedBatchCanBeRolledBack() {
        List<TxAux> batch = List.of(aux(first), aux(second), aux(third));
        LedgerModifier modifier = builder.build(batch).value;
        store.apply(modifier);

        assertEquals(Optional.empty(), store.lookup(aliceCoin));
        assertEquals(Coin.of(85), store.totalStake());
        assertEquals(2, store.size());

        store.apply(builder.rollback(batch, modifier.undos()));

        assertEquals(Optional.of(outAux(ALICE, 100)), store.lookup(aliceCoin));
        assertEquals(Optional.empty(), store.lookup(new OutPoint(first.id(), 1)));
        assertEquals(Optional.empty(), store.lookup(new OutPoint(third.id(), 0)));
        assertEquals(1, store.size());
        assertEquals(Coin.of(100), store.totalStake());
        assertEquals(Coin.of(100), store.stakeOf(ALICE.getStakeholderId()).orElseThrow());
    }

    @Test
    void rollbackWithoutUndoIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.rollback(List.of(aux(first)), UndoMap.empty()));
    }
}
