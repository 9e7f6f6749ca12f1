package com.walletd.address;

public enum ChangeAddressPolicy {
    /** Send change to internal index 0. */
    REUSE_EXISTING,
    /** Derive the next unused internal address. */
    FRESH
}
