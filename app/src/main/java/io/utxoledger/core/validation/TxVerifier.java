package io.utxoledger.core.validation;

import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxCodec;
import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOut;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.protocol.SignatureVerifier;
import io.utxoledger.core.protocol.TxUndo;

import java.math.BigInteger;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static io.utxoledger.core.validation.Violation.Kind.*;

/**
 * Structural and ledger verification of single transactions.
 *
 * Every check runs; the result lists all violated properties rather than the
 * first one. Verification has no side effects, so one instance can be shared
 * across threads. With an executor, the signature checks of a transaction are
 * fanned out as separate tasks.
 */
public final class TxVerifier {

    private final SignatureVerifier signatures;
    private final ExecutorService executor;

    public TxVerifier(SignatureVerifier signatures, ExecutorService executor) {
        this.signatures = signatures;
        this.executor = executor;
    }

    public TxVerifier(SignatureVerifier signatures) {
        this(signatures, null);
    }

    public TxVerifier() {
        this(SignatureVerifier.ecdsa(), null);
    }

    /** Well-formedness: non-empty inputs, non-empty outputs, every output value positive. */
    public static VerificationResult<Void> verifyTxAlone(Tx tx) {
        Set<Violation> violations = new LinkedHashSet<>();
        checkStructure(tx, violations);
        return violations.isEmpty() ? VerificationResult.ok(null) : VerificationResult.failure(violations);
    }

    private static void checkStructure(Tx tx, Set<Violation> violations) {
        if (tx.inputs().isEmpty()) {
            violations.add(Violation.of(EMPTY_INPUTS, "Transaction has no inputs"));
        }
        if (tx.outputs().isEmpty()) {
            violations.add(Violation.of(EMPTY_OUTPUTS, "Transaction has no outputs"));
        }
        for (int i = 0; i < tx.outputs().size(); i++) {
            if (!tx.outputs().get(i).value().isPositive()) {
                violations.add(Violation.at(NON_POSITIVE_OUTPUT, i, "Output value must be > 0"));
            }
        }
    }

    /**
     * Verifies {@code tx} against the outputs visible through {@code resolver}.
     * On success the value is the undo record: the resolved outputs in input order.
     */
    public VerificationResult<TxUndo> verifyTx(UtxoResolver resolver, Tx tx) {
        Set<Violation> violations = new LinkedHashSet<>();
        checkStructure(tx, violations);

        List<TxIn> inputs = tx.inputs();
        List<Optional<TxOutAux>> resolved = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Optional<TxOutAux> out = resolver.resolve(inputs.get(i));
            resolved.add(out);
            if (out.isEmpty()) {
                violations.add(Violation.at(UNRESOLVED_INPUT, i, "Unknown or spent input " + inputs.get(i).outPoint()));
            }
        }

        List<Boolean> sigResults = checkSignatures(inputs, resolved, tx.outputs());
        for (int i = 0; i < inputs.size(); i++) {
            if (resolved.get(i).isPresent() && !sigResults.get(i)) {
                violations.add(Violation.at(BAD_SIGNATURE, i, "Bad signature for input " + inputs.get(i).outPoint()));
            }
        }

        BigInteger inSum = BigInteger.ZERO;
        for (Optional<TxOutAux> out : resolved) {
            if (out.isPresent()) inSum = inSum.add(out.get().out().value().toBigInteger());
        }
        BigInteger outSum = BigInteger.ZERO;
        for (TxOut out : tx.outputs()) {
            outSum = outSum.add(out.value().toBigInteger());
        }
        if (inSum.compareTo(outSum) < 0) {
            violations.add(Violation.of(INSUFFICIENT_VALUE, "Inputs " + inSum + " < outputs " + outSum));
        }

        if (!violations.isEmpty()) {
            return VerificationResult.failure(violations);
        }
        List<TxOutAux> spent = new ArrayList<>(resolved.size());
        for (Optional<TxOutAux> out : resolved) spent.add(out.get());
        return VerificationResult.ok(new TxUndo(spent));
    }

    private List<Boolean> checkSignatures(List<TxIn> inputs, List<Optional<TxOutAux>> resolved, List<TxOut> outputs) {
        List<Callable<Boolean>> checks = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            TxIn in = inputs.get(i);
            Optional<TxOutAux> out = resolved.get(i);
            if (out.isEmpty()) {
                checks.add(() -> Boolean.FALSE);
                continue;
            }
            PublicKey key = out.get().out().address().key();
            checks.add(() -> signatures.verify(key, TxCodec.sigData(in.txId(), in.index(), outputs), in.signature()));
        }

        List<Boolean> results = new ArrayList<>(checks.size());
        if (executor == null || checks.size() < 2) {
            for (Callable<Boolean> check : checks) {
                results.add(callUnchecked(check));
            }
            return results;
        }
        try {
            for (Future<Boolean> f : executor.invokeAll(checks)) {
                results.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking signatures", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Signature check failed", e.getCause());
        }
        return results;
    }

    private static Boolean callUnchecked(Callable<Boolean> check) {
        try {
            return check.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Signature check failed", e);
        }
    }
}
