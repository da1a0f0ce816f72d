package io.utxoledger.core.wallet;

import io.utxoledger.core.protocol.Address;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.SignatureUtil;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.TxCodec;
import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOut;

import java.security.*;
import java.util.List;

/** Key pair owning an address; signs spends of the outputs sent to it. */
public class Wallet {
    private static final int KEY_SIZE = 256;

    private final KeyPair keyPair;
    private final Address address;

    public Wallet(KeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = new Address(keyPair.getPublic());
    }

    public static Wallet generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(KEY_SIZE);
            return new Wallet(generator.generateKeyPair());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("EC key generation unavailable", e);
        }
    }

    public Address getAddress() {
        return address;
    }

    public StakeholderId getStakeholderId() {
        return address.stakeholderId();
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, getPrivateKey());
    }

    /** Input spending {@code (txId, index)} into {@code outputs}. */
    public TxIn signInput(Hash txId, int index, List<TxOut> outputs) {
        return new TxIn(txId, index, sign(TxCodec.sigData(txId, index, outputs)));
    }

    public TxIn signInput(OutPoint point, List<TxOut> outputs) {
        return signInput(point.txId(), point.index(), outputs);
    }
}
