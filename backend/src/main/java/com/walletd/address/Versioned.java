package com.walletd.address;

/**
 * Value paired with the directory version it was built from.
 */
public record Versioned<T>(long version, T value) {
}
