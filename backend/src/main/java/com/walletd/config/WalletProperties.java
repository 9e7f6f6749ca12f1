package com.walletd.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;


/**
 * Network and spending parameters of the wallet.
 */
@ConfigurationProperties(prefix = "walletd.wallet")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class WalletProperties {

    /** Address prefix of the network (kaspa, kaspatest, kaspadev, kaspasim). */
    @NotBlank
    private String addressPrefix = "kaspa";

    /** DAA score distance after which a coinbase output can be spent. */
    @PositiveOrZero
    private long coinbaseMaturity = 1_000;

    /** Signatures required per input; 1 for single-key wallets. */
    @Positive
    private int minimumSignatures = 1;

    /** Selection keeps adding inputs until the change reaches this amount (sompi), when funds allow. */
    @PositiveOrZero
    private long minChangeTarget = 10 * 100_000_000L;

    /** Fee cap (sompi) when the caller gives no fee policy. */
    @Positive
    private long defaultMaxFee = 100_000_000L;
}
