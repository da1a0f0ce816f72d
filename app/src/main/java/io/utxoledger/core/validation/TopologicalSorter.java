package io.utxoledger.core.validation;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxIn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Orders a batch so that every transaction comes after the transactions whose
 * outputs it spends. Inputs referring to transactions outside the batch put no
 * constraint on the order.
 */
public final class TopologicalSorter {
    private TopologicalSorter() {}

    /** Returns empty if the spends inside {@code txs} form a cycle. */
    public static Optional<List<Tx>> topsortTxs(List<Tx> txs) {
        return sort(txs, Tx::id, TopologicalSorter::spentTxIds);
    }

    private static List<Hash> spentTxIds(Tx tx) {
        List<Hash> ids = new ArrayList<>(tx.inputs().size());
        for (TxIn in : tx.inputs()) ids.add(in.txId());
        return ids;
    }

    /**
     * Kahn's algorithm: items whose dependencies are all placed become ready.
     * No particular order is promised between independent items. Several
     * items may share an id; a dependency on that id waits for all of them.
     *
     * @param idOf           identity of an item
     * @param dependenciesOf ids an item depends on; ids not in the batch are ignored
     * @return the sorted items, or empty if the dependencies contain a cycle
     */
    public static <T, K> Optional<List<T>> sort(List<T> items,
                                                Function<T, K> idOf,
                                                Function<T, ? extends Collection<K>> dependenciesOf) {
        int n = items.size();
        Map<K, List<Integer>> byId = new HashMap<>();
        for (int i = 0; i < n; i++) {
            byId.computeIfAbsent(idOf.apply(items.get(i)), k -> new ArrayList<>()).add(i);
        }

        // dependents.get(b) = items waiting on b
        List<Set<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) dependents.add(new LinkedHashSet<>());
        int[] pending = new int[n];

        for (int a = 0; a < n; a++) {
            Set<Integer> producers = new LinkedHashSet<>();
            for (K dep : dependenciesOf.apply(items.get(a))) {
                List<Integer> matches = byId.get(dep);
                if (matches != null) producers.addAll(matches);
            }
            for (int b : producers) {
                dependents.get(b).add(a);
                pending[a]++;
            }
        }

        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (pending[i] == 0) ready.addLast(i);
        }

        List<T> sorted = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int b = ready.removeFirst();
            sorted.add(items.get(b));
            for (int a : dependents.get(b)) {
                if (--pending[a] == 0) ready.addLast(a);
            }
        }
        // anything left is on (or behind) a cycle
        return sorted.size() == n ? Optional.of(sorted) : Optional.empty();
    }
}
