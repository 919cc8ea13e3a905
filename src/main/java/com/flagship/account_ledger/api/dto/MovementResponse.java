package com.flagship.account_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.ledger.LedgerIds;
import com.flagship.account_ledger.movement.MovementReceipt;
import com.flagship.account_ledger.movement.MovementType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MovementResponse {

    @JsonProperty("transfer_id")
    String transferId;

    @JsonProperty("type")
    MovementType type;

    @JsonProperty("debit_account_id")
    String debitAccountId;

    @JsonProperty("credit_account_id")
    String creditAccountId;

    @JsonProperty("amount")
    long amount;

    public static MovementResponse from(MovementReceipt receipt) {
        return MovementResponse.builder()
            .transferId(LedgerIds.format(receipt.getTransferId()))
            .type(receipt.getType())
            .debitAccountId(LedgerIds.format(receipt.getDebitAccountId()))
            .creditAccountId(LedgerIds.format(receipt.getCreditAccountId()))
            .amount(receipt.getAmount())
            .build();
    }
}
