package io.utxoledger.core.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of a verification: either a value, or every violation found.
 * Failures are data, never exceptions.
 */
public final class VerificationResult<T> {
    public final boolean ok;
    public final T value;
    public final Set<Violation> violations;

    private VerificationResult(boolean ok, T value, Set<Violation> violations) {
        this.ok = ok; this.value = value; this.violations = violations;
    }

    public static <T> VerificationResult<T> ok(T value) {
        return new VerificationResult<>(true, value, Collections.emptySet());
    }

    public static <T> VerificationResult<T> failure(Collection<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("failure requires at least one violation");
        }
        return new VerificationResult<>(false, null, Collections.unmodifiableSet(new LinkedHashSet<>(violations)));
    }

    public static <T> VerificationResult<T> failure(Violation violation) {
        return failure(Collections.singleton(violation));
    }

    /** Re-types a failure; must not be called on success. */
    public <U> VerificationResult<U> castFailure() {
        if (ok) throw new IllegalStateException("not a failure");
        return new VerificationResult<>(false, null, violations);
    }

    public Set<Violation.Kind> kinds() {
        Set<Violation.Kind> kinds = EnumSet.noneOf(Violation.Kind.class);
        for (Violation v : violations) kinds.add(v.kind);
        return kinds;
    }

    public boolean has(Violation.Kind kind) {
        return kinds().contains(kind);
    }

    @Override public String toString() {
        return ok ? "OK" : ("ERR" + violations);
    }
}
