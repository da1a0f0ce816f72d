package io.utxoledger.core.node;

import io.utxoledger.core.config.LedgerConfig;
import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.state.UndoMap;
import io.utxoledger.core.validation.VerificationResult;
import io.utxoledger.core.validation.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static io.utxoledger.core.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class LedgerNodeTest {

    @TempDir
    Path tempDir;

    @Test
    void batchCommitNormalizesMempoolAndRollsBack() {
        try (LedgerNode node = LedgerNode.inMemory(new LedgerConfig(10, 2, null))) {
            OutPoint aliceCoin = fund(node.store(), "alice", ALICE, 100);
            OutPoint bobCoin = fund(node.store(), "bob", BOB, 50);

            TxAux pending = aux(spend(ALICE, aliceCoin, out(CAROL, 100)));
            assertTrue(node.submit(pending).ok);

            Tx blockTx = spendAll(List.of(ALICE, BOB), List.of(aliceCoin, bobCoin), List.of(out(CAROL, 140)));
            List<TxAux> block = List.of(aux(blockTx));
            VerificationResult<UndoMap> applied = node.applyBatch(block);

            assertTrue(applied.ok, applied::toString);
            assertEquals(Coin.of(140), node.store().totalStake());
            assertEquals(Coin.of(140), node.store().stakeOf(CAROL.getStakeholderId()).orElseThrow());
            assertEquals(0, node.processor().size());

            node.rollbackBatch(block, applied.value);

            assertEquals(Coin.of(150), node.store().totalStake());
            assertTrue(node.store().lookup(aliceCoin).isPresent());
            assertTrue(node.store().lookup(bobCoin).isPresent());
            assertEquals(Optional.empty(), node.store().lookup(new OutPoint(blockTx.id(), 0)));
        }
    }

    @Test
    void confirmingPendingTxsCountsNoRejections() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            OutPoint aliceCoin = fund(node.store(), "alice", ALICE, 100);
            Tx parent = spend(ALICE, aliceCoin, out(BOB, 100));
            Tx child = spend(BOB, new OutPoint(parent.id(), 0), out(CAROL, 100));
            assertTrue(node.submit(aux(parent)).ok);
            assertTrue(node.submit(aux(child)).ok);
            double rejected = LedgerMetrics.registry().counter("ledger.tx.rejected").count();

            assertTrue(node.applyBatch(List.of(aux(parent), aux(child))).ok);

            assertEquals(rejected, LedgerMetrics.registry().counter("ledger.tx.rejected").count());
            assertEquals(0, node.processor().size());
            assertEquals(List.of(), node.processor().normalize());
        }
    }

    @Test
    void rejectedBatchLeavesStoreUntouched() {
        try (LedgerNode node = LedgerNode.inMemory(LedgerConfig.defaultLocal())) {
            OutPoint aliceCoin = fund(node.store(), "alice", ALICE, 100);
            Tx good = spend(ALICE, aliceCoin, out(BOB, 100));
            Tx forged = spend(CAROL, new OutPoint(good.id(), 0), out(CAROL, 100));

            VerificationResult<UndoMap> result = node.applyBatch(List.of(aux(good), aux(forged)));

            assertEquals(EnumSet.of(Violation.Kind.BAD_SIGNATURE), result.kinds());
            assertEquals(Optional.of(outAux(ALICE, 100)), node.store().lookup(aliceCoin));
            assertEquals(1, node.store().size());
        }
    }

    @Test
    void rocksLedgerRequiresDataDir() {
        assertThrows(IllegalArgumentException.class, () -> LedgerNode.rocks(LedgerConfig.defaultLocal()));

        try (LedgerNode node = LedgerNode.rocks(LedgerConfig.defaultLocal().withDataDir(tempDir.toString()))) {
            OutPoint coin = fund(node.store(), "alice", ALICE, 10);
            assertTrue(node.submit(aux(spend(ALICE, coin, out(BOB, 10)))).ok);
            assertTrue(node.applyBatch(List.of(aux(spend(ALICE, coin, out(CAROL, 10))))).ok);
            assertEquals(0, node.processor().size());
        }
    }
}
