package com.walletd.service;

public record AddressBalance(String address, long available, long pending) {
}
