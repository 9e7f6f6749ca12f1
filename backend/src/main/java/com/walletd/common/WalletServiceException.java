package com.walletd.common;

import lombok.Getter;

/**
 * Caller-facing wallet failure. The error code tells the caller whether to fix the request, wait or give up.
 */
@Getter
public class WalletServiceException extends RuntimeException {

    public enum ErrorCode {
        USER_INPUT,
        INSUFFICIENT_FUNDS,
        RESTRICTION_UNSATISFIABLE,
        NOT_SYNCED,
        SANITY_CHECK_FAILED,
        INTERNAL
    }

    private final ErrorCode errorCode;

    public WalletServiceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public WalletServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static WalletServiceException userInput(String message) {
        return new WalletServiceException(ErrorCode.USER_INPUT, message);
    }

    public static WalletServiceException sanityCheck(String message) {
        return new WalletServiceException(ErrorCode.SANITY_CHECK_FAILED, message);
    }
}
