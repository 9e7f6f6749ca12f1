package com.walletd.tx;

import com.walletd.common.Sompi;
import com.walletd.common.WalletServiceException;
import lombok.Getter;

@Getter
public class InsufficientFundsException extends WalletServiceException {

    private final long required;
    private final long available;

    public InsufficientFundsException(long required, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS, "Insufficient funds for send: " + Sompi.toKasString(required)
                + " required, while only " + Sompi.toKasString(available) + " available");
        this.required = required;
        this.available = available;
    }

    public InsufficientFundsException(String message, long required, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS, message);
        this.required = required;
        this.available = available;
    }
}
