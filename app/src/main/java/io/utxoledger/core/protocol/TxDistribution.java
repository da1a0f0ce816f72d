package io.utxoledger.core.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Stake distribution of every output of a transaction, by output index. */
public final class TxDistribution {
    private final List<Map<StakeholderId, Coin>> perOutput;

    public TxDistribution(List<Map<StakeholderId, Coin>> perOutput) {
        List<Map<StakeholderId, Coin>> copy = new ArrayList<>();
        if (perOutput != null) {
            for (Map<StakeholderId, Coin> m : perOutput) {
                copy.add(m == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(m)));
            }
        }
        this.perOutput = Collections.unmodifiableList(copy);
    }

    /** Default distribution: every output's stake goes to its address owner. */
    public static TxDistribution empty(int outputs) {
        List<Map<StakeholderId, Coin>> list = new ArrayList<>(outputs);
        for (int i = 0; i < outputs; i++) list.add(Collections.emptyMap());
        return new TxDistribution(list);
    }

    public int size() { return perOutput.size(); }

    public Map<StakeholderId, Coin> forOutput(int index) { return perOutput.get(index); }
}
