package com.flagship.account_ledger.ledger;

/**
 * Category code stored on every ledger account.
 */
public enum AccountCategory {
    MASTER_DEBIT(1),
    MASTER_CREDIT(2),
    USER(100);

    private final int code;

    AccountCategory(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static AccountCategory fromCode(int code) {
        for (AccountCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown account category code: " + code);
    }
}
