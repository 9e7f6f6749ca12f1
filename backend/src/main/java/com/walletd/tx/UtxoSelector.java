package com.walletd.tx;

import com.walletd.common.WalletServiceException;
import com.walletd.domain.Outpoint;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletUtxo;
import com.walletd.utxo.UtxoView;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks inputs smallest first from a view's sorted index.
 * <p>
 * A fixed amount stops early when the inputs pay amount plus fee exactly, or when at least two inputs leave
 * {@code minChangeTarget} of change; otherwise every eligible UTXO is considered and the whole set is used.
 * The fee is recomputed as inputs are added since mass grows with every input.
 * <p>
 * Preselected outpoints are spent as given: no other UTXO is added to them.
 */
@Slf4j
public class UtxoSelector {

    private final MassCalculator massCalculator;
    private final long coinbaseMaturity;
    private final long minChangeTarget;
    private final int sigOpCount;

    public UtxoSelector(MassCalculator massCalculator, long coinbaseMaturity, long minChangeTarget, int sigOpCount) {
        this.massCalculator = massCalculator;
        this.coinbaseMaturity = coinbaseMaturity;
        this.minChangeTarget = minChangeTarget;
        this.sigOpCount = sigOpCount;
    }

    public Selection select(UtxoView view, SelectionRequest request, long virtualDaaScore) {
        Set<WalletAddress> allowed = request.restriction().isEmpty() ? null : new HashSet<>(request.restriction());
        List<WalletUtxo> selected = new ArrayList<>();
        Set<Outpoint> preselected = new HashSet<>();
        long total = 0;
        for (Outpoint outpoint : request.preselected()) {
            if (!preselected.add(outpoint)) {
                continue;
            }
            WalletUtxo utxo = view.get(outpoint)
                    .orElseThrow(() -> WalletServiceException.userInput("UTXO " + outpoint + " not found or already spent"));
            if (utxo.isImmatureCoinbase(virtualDaaScore, coinbaseMaturity)) {
                throw WalletServiceException.userInput("UTXO " + outpoint + " is a coinbase output that is not mature yet");
            }
            selected.add(utxo);
            total += utxo.amount();
        }

        if (request.sendAll()) {
            long outsideRestriction = 0;
            if (preselected.isEmpty()) {
                for (WalletUtxo utxo : view.sortedByAmount()) {
                    if (utxo.isImmatureCoinbase(virtualDaaScore, coinbaseMaturity)) {
                        continue;
                    }
                    if (allowed != null && !allowed.contains(utxo.address())) {
                        outsideRestriction += utxo.amount();
                        continue;
                    }
                    selected.add(utxo);
                    total += utxo.amount();
                }
            }
            return sendAll(selected, total, request, allowed != null && outsideRestriction > 0);
        }

        long amount = request.amount();
        if (amount <= 0) {
            throw WalletServiceException.userInput("Amount must be positive");
        }
        long outsideRestriction = 0;
        if (preselected.isEmpty()) {
            for (WalletUtxo utxo : view.sortedByAmount()) {
                if (utxo.isImmatureCoinbase(virtualDaaScore, coinbaseMaturity)) {
                    continue;
                }
                if (allowed != null && !allowed.contains(utxo.address())) {
                    outsideRestriction += utxo.amount();
                    continue;
                }
                selected.add(utxo);
                total += utxo.amount();
                if (isGoodEnough(total, selected.size(), request)) {
                    break;
                }
            }
        }

        long required = amount + fee(selected.size(), false, request);
        if (total < required) {
            if (selected.isEmpty() && outsideRestriction > 0) {
                throw new RestrictionUnsatisfiableException(request.restriction().size());
            }
            throw new InsufficientFundsException(required, total);
        }
        return settle(selected, total, amount, request);
    }

    /** Fee of a transaction with {@code inputCount} inputs, a recipient output and optionally a change output. */
    public long fee(int inputCount, boolean withChange, SelectionRequest request) {
        List<ScriptPublicKey> outputs = withChange
                ? List.of(request.recipientScript(), request.changeScript())
                : List.of(request.recipientScript());
        long mass = massCalculator.estimateMass(inputCount, sigOpCount, outputs, request.payloadLength());
        return massCalculator.feeFor(mass, request.feeLimits());
    }

    private boolean isGoodEnough(long total, int count, SelectionRequest request) {
        if (count == 0) {
            return false;
        }
        if (total == request.amount() + fee(count, false, request)) {
            return true;
        }
        return count > 1 && total >= request.amount() + fee(count, true, request) + minChangeTarget;
    }

    Selection settle(List<WalletUtxo> selected, long total, long amount, SelectionRequest request) {
        int n = selected.size();
        long feeWithChange = fee(n, true, request);
        if (total >= amount + feeWithChange) {
            long change = total - amount - feeWithChange;
            if (change >= massCalculator.dustThreshold(request.changeScript(), request.feeLimits().feeRate())) {
                return new Selection(selected, total, amount, change, feeWithChange);
            }
            log.debug("Change of {} sompi is dust, adding it to the fee", change);
        }
        return new Selection(selected, total, amount, 0, total - amount);
    }

    private Selection sendAll(List<WalletUtxo> selected, long total, SelectionRequest request, boolean fundsOutsideRestriction) {
        if (total == 0) {
            if (fundsOutsideRestriction) {
                throw new RestrictionUnsatisfiableException(request.restriction().size());
            }
            throw new InsufficientFundsException("No funds to send", 1, 0);
        }
        long fee = fee(selected.size(), false, request);
        if (total <= fee) {
            throw new InsufficientFundsException(fee + 1, total);
        }
        return new Selection(selected, total, total - fee, 0, fee);
    }
}
