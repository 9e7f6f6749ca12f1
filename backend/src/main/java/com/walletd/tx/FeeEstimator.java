package com.walletd.tx;

import com.walletd.common.WalletServiceException;
import com.walletd.config.WalletProperties;
import com.walletd.node.NodeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link FeePolicy} against the node's current fee estimate.
 */
@Component
@RequiredArgsConstructor
public class FeeEstimator {

    public static final double MIN_FEE_RATE = 1.0;

    private final NodeClient nodeClient;
    private final WalletProperties walletProperties;

    public FeeLimits resolve(FeePolicy policy) {
        FeePolicy p = policy != null ? policy : FeePolicy.nodeEstimate();
        return switch (p.kind()) {
            case EXACT_FEE_RATE -> {
                requireMinimumRate(p.value(), "exact fee rate");
                yield FeeLimits.uncapped(p.value());
            }
            case MAX_FEE_RATE -> {
                requireMinimumRate(p.value(), "max fee rate");
                yield FeeLimits.uncapped(Math.min(nodeRate(), p.value()));
            }
            case MAX_FEE -> {
                if (p.value() < 1) {
                    throw WalletServiceException.userInput("max fee must be positive, got " + (long) p.value());
                }
                yield new FeeLimits(nodeRate(), (long) p.value());
            }
            case NODE_ESTIMATE -> new FeeLimits(nodeRate(), walletProperties.getDefaultMaxFee());
        };
    }

    private double nodeRate() {
        return Math.max(MIN_FEE_RATE, nodeClient.getFeeEstimate());
    }

    private static void requireMinimumRate(double rate, String what) {
        if (rate < MIN_FEE_RATE) {
            throw WalletServiceException.userInput(what + " must be at least " + MIN_FEE_RATE + " sompi/gram, got " + rate);
        }
    }
}
