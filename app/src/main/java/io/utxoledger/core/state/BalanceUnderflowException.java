package io.utxoledger.core.state;

import io.utxoledger.core.protocol.StakeholderId;

public final class BalanceUnderflowException extends IllegalStateException {
    private final StakeholderId stakeholder;

    public BalanceUnderflowException(StakeholderId stakeholder, String message) {
        super(message);
        this.stakeholder = stakeholder;
    }

    public StakeholderId stakeholder() { return stakeholder; }
}
