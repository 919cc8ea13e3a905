package com.flagship.account_ledger.movement;

import com.flagship.account_ledger.identity.Identity;
import lombok.Value;

/**
 * An identity together with its ledger balance.
 *
 * {@code degraded} is true when the ledger could not be read and {@code balance} is the 0
 * fallback rather than a real reading.
 */
@Value
public class IdentityBalance {
    Identity identity;
    long balance;
    boolean degraded;
}
