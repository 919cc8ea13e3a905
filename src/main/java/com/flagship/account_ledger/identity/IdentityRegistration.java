package com.flagship.account_ledger.identity;

import lombok.Value;

/**
 * Fields needed to register a new identity. The password is hashed by the directory.
 */
@Value
public class IdentityRegistration {
    String email;
    String password;
    String fullName;
}
