package com.walletd.domain;

import java.util.Objects;

public record Payment(String address, long amount) {

    public Payment {
        Objects.requireNonNull(address, "address");
        if (amount < 0) {
            throw new IllegalArgumentException("Payment amount must be non-negative: " + amount);
        }
    }
}
