package io.utxoledger.core.metrics;

import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.state.LedgerModifierBuilder;
import io.utxoledger.core.storage.InMemoryUtxoStore;
import io.utxoledger.core.validation.TxVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.utxoledger.core.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    private static double count(String name) {
        return LedgerMetrics.registry().counter(name).count();
    }

    @Test
    void batchBuildUpdatesCounters() {
        InMemoryUtxoStore store = new InMemoryUtxoStore();
        OutPoint coin = fund(store, "metrics", ALICE, 10);
        LedgerModifierBuilder builder = new LedgerModifierBuilder(store, new TxVerifier());
        double accepted = count("ledger.tx.accepted");
        double rejected = count("ledger.tx.rejected");
        double batches = count("ledger.batch.rejected");
        long builds = LedgerMetrics.registry().timer("ledger.batch.build.time").count();

        assertTrue(builder.build(List.of(aux(spend(ALICE, coin, out(BOB, 10))))).ok);
        assertFalse(builder.build(List.of(aux(spend(BOB, coin, out(BOB, 10))))).ok);

        assertEquals(accepted + 1, count("ledger.tx.accepted"));
        assertEquals(rejected + 1, count("ledger.tx.rejected"));
        assertEquals(batches + 1, count("ledger.batch.rejected"));
        assertEquals(builds + 2, LedgerMetrics.registry().timer("ledger.batch.build.time").count());
        assertTrue(LedgerMetrics.scrapeMetrics().contains("ledger.batch.size"));
    }
}
