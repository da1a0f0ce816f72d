package io.utxoledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter txAccepted = registry.counter("ledger.tx.accepted");
    private static final Counter txRejected = registry.counter("ledger.tx.rejected");
    private static final Counter batchesRejected = registry.counter("ledger.batch.rejected");
    private static final Timer batchBuildTime = registry.timer("ledger.batch.build.time");
    private static final DistributionSummary batchSize = DistributionSummary.builder("ledger.batch.size")
            .baseUnit("transactions")
            .description("Transactions per verified batch")
            .register(registry);

    private LedgerMetrics() {}

    public static <T> T recordBatchBuild(Supplier<T> buildLogic) {
        return batchBuildTime.record(buildLogic);
    }

    public static void txAccepted() {
        txAccepted.increment();
    }

    public static void txRejected() {
        txRejected.increment();
    }

    public static void batchRejected() {
        batchesRejected.increment();
    }

    public static void batchSize(int txs) {
        batchSize.record(txs);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
