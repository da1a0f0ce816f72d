package io.utxoledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical binary encodings. All integers are big-endian; variable-length
 * fields are prefixed with a 4-byte length.
 *
 * <pre>
 * Tx       := u32 nIn || TxIn* || u32 nOut || TxOut*
 * TxIn     := hash(32) || u32 index || bytes signature
 * TxOut    := bytes addressKey || u64 coin
 * SigData  := hash(32) || u32 index || u32 nOut || TxOut*
 * TxOutAux := TxOut || u32 nDist || (string stakeholder || u64 coin)*
 * OutPoint := hash(32) || u32 index
 * </pre>
 */
public final class TxCodec {
    private TxCodec(){}

    public static byte[] encode(Tx tx) {
        int size = 4 + 4 + outputsSize(tx.outputs());
        for (TxIn in : tx.inputs()) size += Hash.LENGTH + 4 + 4 + in.signature().length;

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(tx.inputs().size());
        for (TxIn in : tx.inputs()) {
            buf.put(in.txId().bytes());
            buf.putInt(in.index());
            putBytes(buf, in.signature());
        }
        putOutputs(buf, tx.outputs());
        return sliceToArray(buf);
    }

    /** Message signed by the owner of output {@code (txId, index)} when spending it into {@code outputs}. */
    public static byte[] sigData(Hash txId, int index, List<TxOut> outputs) {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH + 4 + 4 + outputsSize(outputs));
        buf.put(txId.bytes());
        buf.putInt(index);
        putOutputs(buf, outputs);
        return sliceToArray(buf);
    }

    public static byte[] encodeOutPoint(OutPoint point) {
        ByteBuffer buf = ByteBuffer.allocate(Hash.LENGTH + 4);
        buf.put(point.txId().bytes());
        buf.putInt(point.index());
        return sliceToArray(buf);
    }

    public static OutPoint decodeOutPoint(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            byte[] hash = new byte[Hash.LENGTH];
            buf.get(hash);
            return new OutPoint(new Hash(hash), buf.getInt());
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed OutPoint bytes", ex);
        }
    }

    public static byte[] encodeTxOutAux(TxOutAux aux) {
        int size = outputSize(aux.out()) + 4;
        for (StakeholderId id : aux.distribution().keySet()) {
            size += 4 + id.hex().getBytes(StandardCharsets.UTF_8).length + 8;
        }
        ByteBuffer buf = ByteBuffer.allocate(size);
        putOutput(buf, aux.out());
        buf.putInt(aux.distribution().size());
        for (Map.Entry<StakeholderId, Coin> e : aux.distribution().entrySet()) {
            putBytes(buf, e.getKey().hex().getBytes(StandardCharsets.UTF_8));
            buf.putLong(e.getValue().value());
        }
        return sliceToArray(buf);
    }

    public static TxOutAux decodeTxOutAux(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            TxOut out = readOutput(buf);
            int n = buf.getInt();
            if (n < 0) throw new IllegalArgumentException("Bad distribution size: " + n);
            Map<StakeholderId, Coin> dist = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                StakeholderId id = new StakeholderId(new String(readBytes(buf), StandardCharsets.UTF_8));
                dist.put(id, Coin.of(buf.getLong()));
            }
            return new TxOutAux(out, dist);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed TxOutAux bytes", ex);
        }
    }

    // -------------------- helpers --------------------
    private static int outputsSize(List<TxOut> outputs) {
        int size = 4;
        for (TxOut out : outputs) size += outputSize(out);
        return size;
    }

    private static int outputSize(TxOut out) {
        return 4 + out.address().encoded().length + 8;
    }

    private static void putOutputs(ByteBuffer buf, List<TxOut> outputs) {
        buf.putInt(outputs.size());
        for (TxOut out : outputs) putOutput(buf, out);
    }

    private static void putOutput(ByteBuffer buf, TxOut out) {
        putBytes(buf, out.address().encoded());
        buf.putLong(out.value().value());
    }

    private static TxOut readOutput(ByteBuffer buf) {
        Address address = new Address(SignatureUtil.decodePublicKey(readBytes(buf)));
        return new TxOut(address, Coin.of(buf.getLong()));
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static byte[] sliceToArray(ByteBuffer buf){
        buf.flip(); byte[] out = new byte[buf.remaining()]; buf.get(out); return out;
    }
}
