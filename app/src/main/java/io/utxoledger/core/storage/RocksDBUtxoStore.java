package io.utxoledger.core.storage;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.TxCodec;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.state.LedgerModifier;
import io.utxoledger.core.state.UtxoModifier;
import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent UtxoStore using RocksDB.
 *
 * Layout (column families):
 *  - "utxo"   : key = txId(32) || index(4), val = TxCodec TxOutAux encoding
 *  - "stakes" : key = stakeholder id (UTF-8 hex), val = coin(8, big-endian)
 *  - "meta"   : key = "total",                    val = coin(8, big-endian)
 */
public final class RocksDBUtxoStore implements UtxoStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBUtxoStore.class.getName());
    private static final byte[] TOTAL_KEY = "total".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfUtxo;
    private final ColumnFamilyHandle cfStakes;
    private final ColumnFamilyHandle cfMeta;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBUtxoStore(RocksDB db, List<ColumnFamilyHandle> handles, DBOptions dbOptions) {
        this.db = db;
        this.handles = handles;
        // index 0 is the default CF
        this.cfUtxo = handles.get(1);
        this.cfStakes = handles.get(2);
        this.cfMeta = handles.get(3);
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBUtxoStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("utxo".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("stakes".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info("Opened UTXO store at " + dataDir);
            return new RocksDBUtxoStore(db, cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- UtxoStore API ----------------

    @Override
    public synchronized Optional<TxOutAux> lookup(OutPoint point) {
        try {
            byte[] val = db.get(cfUtxo, TxCodec.encodeOutPoint(point));
            return val == null ? Optional.empty() : Optional.of(TxCodec.decodeTxOutAux(val));
        } catch (RocksDBException e) {
            throw new IllegalStateException("lookup failed", e);
        }
    }

    @Override
    public synchronized Optional<Coin> stakeOf(StakeholderId id) {
        try {
            byte[] val = db.get(cfStakes, stakeKey(id));
            return val == null ? Optional.empty() : Optional.of(Coin.of(bytesToLong(val)));
        } catch (RocksDBException e) {
            throw new IllegalStateException("stakeOf failed", e);
        }
    }

    @Override
    public synchronized Coin totalStake() {
        try {
            byte[] val = db.get(cfMeta, TOTAL_KEY);
            return val == null ? Coin.ZERO : Coin.of(bytesToLong(val));
        } catch (RocksDBException e) {
            throw new IllegalStateException("totalStake failed", e);
        }
    }

    @Override
    public synchronized void apply(LedgerModifier modifier) {
        UtxoModifier utxo = modifier.utxoModifier();
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (OutPoint point : utxo.deletions()) {
                batch.delete(cfUtxo, TxCodec.encodeOutPoint(point));
            }
            for (Map.Entry<OutPoint, TxOutAux> e : utxo.insertions().entrySet()) {
                batch.put(cfUtxo, TxCodec.encodeOutPoint(e.getKey()), TxCodec.encodeTxOutAux(e.getValue()));
            }
            for (Map.Entry<StakeholderId, Coin> e : modifier.balances().stakes().entrySet()) {
                if (e.getValue().isPositive()) {
                    batch.put(cfStakes, stakeKey(e.getKey()), longToBytes(e.getValue().value()));
                } else {
                    batch.delete(cfStakes, stakeKey(e.getKey()));
                }
            }
            batch.put(cfMeta, TOTAL_KEY, longToBytes(modifier.balances().total().value()));
            db.write(wo, batch);
            LOG.info("Committed " + modifier);
        } catch (RocksDBException e) {
            throw new IllegalStateException("apply failed", e);
        }
    }

    @Override
    public synchronized void addUnspent(OutPoint point, TxOutAux out) {
        if (lookup(point).isPresent()) {
            throw new IllegalArgumentException("Output already unspent: " + point);
        }
        Coin newTotal = totalStake().add(Coin.sum(out.stakes().values()));
        try (WriteOptions wo = new WriteOptions();
             WriteBatch batch = new WriteBatch()) {
            batch.put(cfUtxo, TxCodec.encodeOutPoint(point), TxCodec.encodeTxOutAux(out));
            for (Map.Entry<StakeholderId, Coin> e : out.stakes().entrySet()) {
                Coin stake = stakeOf(e.getKey()).orElse(Coin.ZERO).add(e.getValue());
                batch.put(cfStakes, stakeKey(e.getKey()), longToBytes(stake.value()));
            }
            batch.put(cfMeta, TOTAL_KEY, longToBytes(newTotal.value()));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("addUnspent failed", e);
        }
    }

    @Override
    public synchronized long size() {
        // RocksJava doesn't expose an exact key count; walk the CF.
        try (RocksIterator it = db.newIterator(cfUtxo)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        // Close CF handles first, then DB/options
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "Failed to close RocksDB cleanly", e);
        }
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private static byte[] stakeKey(StakeholderId id) {
        return id.hex().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        ByteBuffer b = ByteBuffer.wrap(a);
        return b.getLong();
    }
}
