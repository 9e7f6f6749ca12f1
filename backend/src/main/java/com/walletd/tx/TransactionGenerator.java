package com.walletd.tx;

import com.walletd.address.AddressDirectory;
import com.walletd.address.ChangeAddress;
import com.walletd.common.Sompi;
import com.walletd.common.WalletServiceException;
import com.walletd.domain.Outpoint;
import com.walletd.domain.Payment;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletAddress;
import com.walletd.domain.WalletTransaction;
import com.walletd.domain.WalletUtxo;
import com.walletd.node.NodeClient;
import com.walletd.utxo.OverlayView;
import com.walletd.utxo.UtxoStore;
import com.walletd.utxo.UtxoView;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the unsigned transactions for a spend request.
 * <p>
 * When the transaction would exceed the standard mass, its inputs are consolidated first: split transactions
 * each spend a slice of the inputs into one change output, and a final transaction spends those outputs. The
 * final transaction is split again if it is still too heavy. The returned list is in broadcast order.
 */
@Slf4j
public class TransactionGenerator {

    private final AddressDirectory addressDirectory;
    private final UtxoStore utxoStore;
    private final NodeClient nodeClient;
    private final FeeEstimator feeEstimator;
    private final UtxoSelector utxoSelector;
    private final TransactionFactory transactionFactory;
    private final MassCalculator massCalculator;
    private final long coinbaseMaturity;

    public TransactionGenerator(AddressDirectory addressDirectory, UtxoStore utxoStore, NodeClient nodeClient,
                                FeeEstimator feeEstimator, UtxoSelector utxoSelector,
                                TransactionFactory transactionFactory, MassCalculator massCalculator,
                                long coinbaseMaturity) {
        this.addressDirectory = addressDirectory;
        this.utxoStore = utxoStore;
        this.nodeClient = nodeClient;
        this.feeEstimator = feeEstimator;
        this.utxoSelector = utxoSelector;
        this.transactionFactory = transactionFactory;
        this.massCalculator = massCalculator;
        this.coinbaseMaturity = coinbaseMaturity;
    }

    public List<WalletTransaction> createUnsignedTransactions(TransactionRequest request) {
        if (!request.fromAddresses().isEmpty() && !request.preselected().isEmpty()) {
            throw WalletServiceException.userInput("Cannot specify both from addresses and preselected UTXOs");
        }
        ScriptPublicKey recipientScript = transactionFactory.scriptFor(request.toAddress());
        List<WalletAddress> restriction = resolveRestriction(request.fromAddresses());
        String payload = validatePayload(request.payloadHex());
        FeeLimits limits = feeEstimator.resolve(request.feePolicy());
        ChangeAddress change = addressDirectory.changeAddress(request.changeAddressPolicy(), restriction);
        ScriptPublicKey changeScript = transactionFactory.scriptFor(change.address());

        OverlayView view = utxoStore.overlay();
        long virtualDaaScore = nodeClient.getVirtualDaaScore();
        SelectionRequest selectionRequest = new SelectionRequest(request.amount(), request.sendAll(), limits,
                restriction, request.preselected(), recipientScript, changeScript, payload.length() / 2);
        Selection selection = utxoSelector.select(view, selectionRequest, virtualDaaScore);

        WalletTransaction tx = transactionFactory.build(selection.utxos(),
                payments(request.toAddress(), selection.amountToRecipient(), change.address(), selection.change()), payload);

        Set<Outpoint> used = new HashSet<>();
        for (WalletUtxo utxo : selection.utxos()) {
            used.add(utxo.outpoint());
        }
        SplitContext ctx = new SplitContext(view, selectionRequest, virtualDaaScore, change, changeScript,
                request.toAddress(), payload, restriction.isEmpty() ? null : new HashSet<>(restriction), used);
        List<WalletTransaction> chain = maybeSplit(tx, ctx);
        for (WalletTransaction t : chain) {
            checkTransactionFeeRate(t, limits);
        }
        WalletTransaction last = chain.get(chain.size() - 1);
        log.info("Built {} unsigned transaction(s) sending {} to {} (fee {}, {} inputs in total)",
                chain.size(), Sompi.toKasString(selection.amountToRecipient()), request.toAddress(),
                Sompi.toKasString(chain.stream().mapToLong(WalletTransaction::fee).sum()),
                chain.stream().mapToInt(t -> t.inputs().size()).sum());
        log.debug("Final transaction {} has {} outputs", last.transactionId(), last.outputs().size());
        return chain;
    }

    List<WalletTransaction> maybeSplit(WalletTransaction tx, SplitContext ctx) {
        if (massCalculator.estimatedMass(tx) < MassCalculator.MAXIMUM_STANDARD_TRANSACTION_MASS) {
            return List.of(tx);
        }
        if (tx.outputs().isEmpty() || tx.outputs().size() > 2) {
            throw WalletServiceException.sanityCheck("Transaction to split must have 1 or 2 outputs, has " + tx.outputs().size());
        }
        List<WalletUtxo> inputs = inputsOf(tx);
        int capacity = splitCapacity(ctx.changeScript());
        if (capacity < 2) {
            throw WalletServiceException.sanityCheck("Input mass too large to consolidate inputs");
        }
        int splitCount = (inputs.size() + capacity - 1) / capacity;
        log.debug("Splitting {} inputs into {} consolidation transactions of up to {} inputs", inputs.size(), splitCount, capacity);

        List<WalletTransaction> result = new ArrayList<>(splitCount + 1);
        List<WalletUtxo> mergeInputs = new ArrayList<>();
        long splitBaseMass = massCalculator.baseMass(0) + massCalculator.outputMass(ctx.changeScript());
        long perInput = massCalculator.estimatedInputMass(transactionFactory.sigOpCount());
        for (int i = 0; i < splitCount; i++) {
            List<WalletUtxo> slice = inputs.subList(i * capacity, Math.min(inputs.size(), (i + 1) * capacity));
            long sliceTotal = slice.stream().mapToLong(WalletUtxo::amount).sum();
            long sliceFee = massCalculator.feeFor(splitBaseMass + slice.size() * perInput, ctx.request().feeLimits());
            if (sliceTotal <= sliceFee) {
                throw new InsufficientFundsException(sliceFee + 1, sliceTotal);
            }
            long value = sliceTotal - sliceFee;
            WalletTransaction split = transactionFactory.build(slice,
                    List.of(new Payment(ctx.change().address(), value)), "");
            result.add(split);
            UtxoEntry entry = new UtxoEntry(value, ctx.changeScript(), UtxoEntry.UNACCEPTED_DAA_SCORE, false);
            mergeInputs.add(new WalletUtxo(new Outpoint(split.transactionId(), 0), entry, ctx.change().owner()));
        }

        long mergeTotal = mergeInputs.stream().mapToLong(WalletUtxo::amount).sum();
        SelectionRequest request = ctx.request();
        List<Payment> payments;
        if (request.sendAll()) {
            long fee = utxoSelector.fee(mergeInputs.size(), false, request);
            if (mergeTotal <= fee) {
                throw new InsufficientFundsException(fee + 1, mergeTotal);
            }
            payments = List.of(new Payment(ctx.recipient(), mergeTotal - fee));
        } else {
            long amount = request.amount();
            while (mergeTotal < amount + utxoSelector.fee(mergeInputs.size(), false, request)) {
                long required = amount + utxoSelector.fee(mergeInputs.size(), false, request);
                if (!request.preselected().isEmpty()) {
                    throw new InsufficientFundsException(
                            "Insufficient funds in pre-selected utxos for merge transaction fees", required, mergeTotal);
                }
                WalletUtxo extra = ctx.nextTopUp(coinbaseMaturity);
                if (extra == null) {
                    throw new InsufficientFundsException("Insufficient funds for merge transaction fees", required, mergeTotal);
                }
                mergeInputs.add(extra);
                mergeTotal += extra.amount();
            }
            Selection settled = utxoSelector.settle(mergeInputs, mergeTotal, amount, request);
            payments = payments(ctx.recipient(), settled.amountToRecipient(), ctx.change().address(), settled.change());
        }
        WalletTransaction merge = transactionFactory.build(mergeInputs, payments, ctx.payload());
        result.addAll(maybeSplit(merge, ctx));
        return result;
    }

    /** Inputs one consolidation transaction (single change output, no payload) can take below the mass limit. */
    int splitCapacity(ScriptPublicKey changeScript) {
        long splitBaseMass = massCalculator.baseMass(0) + massCalculator.outputMass(changeScript);
        long perInput = massCalculator.estimatedInputMass(transactionFactory.sigOpCount());
        return (int) ((MassCalculator.MAXIMUM_STANDARD_TRANSACTION_MASS - 1 - splitBaseMass) / perInput);
    }

    private void checkTransactionFeeRate(WalletTransaction tx, FeeLimits limits) {
        if (tx.totalInputAmount() < tx.totalOutputAmount()) {
            throw WalletServiceException.sanityCheck("Transaction " + tx.transactionId() + " pays out more than its inputs");
        }
        long mass = massCalculator.estimatedMass(tx);
        double rate = (double) tx.fee() / mass;
        if (rate < FeeEstimator.MIN_FEE_RATE) {
            throw WalletServiceException.userInput("setting max-fee to " + Sompi.toKasString(limits.maxFee())
                    + " results in a fee rate of " + rate + ", which is below the minimum allowed fee rate of "
                    + FeeEstimator.MIN_FEE_RATE + " sompi/gram");
        }
    }

    private List<WalletAddress> resolveRestriction(List<String> fromAddresses) {
        if (fromAddresses.isEmpty()) {
            return List.of();
        }
        Map<String, WalletAddress> owners = addressDirectory.addressOwnerMap().value();
        List<WalletAddress> restriction = new ArrayList<>(fromAddresses.size());
        for (String address : fromAddresses) {
            WalletAddress owner = owners.get(address);
            if (owner == null) {
                throw WalletServiceException.userInput("From address is not in this wallet: " + address);
            }
            restriction.add(owner);
        }
        return restriction;
    }

    private static String validatePayload(String payloadHex) {
        try {
            HexFormat.of().parseHex(payloadHex);
        } catch (IllegalArgumentException e) {
            throw WalletServiceException.userInput("Payload is not valid hex");
        }
        return payloadHex.toLowerCase(Locale.ROOT);
    }

    private static List<Payment> payments(String recipient, long amount, String changeAddress, long change) {
        if (change > 0) {
            return List.of(new Payment(recipient, amount), new Payment(changeAddress, change));
        }
        return List.of(new Payment(recipient, amount));
    }

    private static List<WalletUtxo> inputsOf(WalletTransaction tx) {
        List<WalletUtxo> inputs = new ArrayList<>(tx.inputs().size());
        for (int i = 0; i < tx.inputs().size(); i++) {
            inputs.add(new WalletUtxo(tx.inputs().get(i).previousOutpoint(), tx.inputEntries().get(i), tx.inputOwners().get(i)));
        }
        return inputs;
    }

    /** State carried through recursive splitting; top-up candidates come from the same view as the selection. */
    static final class SplitContext {

        private final UtxoView view;
        private final SelectionRequest request;
        private final long virtualDaaScore;
        private final ChangeAddress change;
        private final ScriptPublicKey changeScript;
        private final String recipient;
        private final String payload;
        private final Set<WalletAddress> allowed;
        private final Set<Outpoint> used;
        private Iterator<WalletUtxo> candidates;

        SplitContext(UtxoView view, SelectionRequest request, long virtualDaaScore, ChangeAddress change,
                     ScriptPublicKey changeScript, String recipient, String payload, Set<WalletAddress> allowed,
                     Set<Outpoint> used) {
            this.view = view;
            this.request = request;
            this.virtualDaaScore = virtualDaaScore;
            this.change = change;
            this.changeScript = changeScript;
            this.recipient = recipient;
            this.payload = payload;
            this.allowed = allowed;
            this.used = used;
        }

        SelectionRequest request() {
            return request;
        }

        ChangeAddress change() {
            return change;
        }

        ScriptPublicKey changeScript() {
            return changeScript;
        }

        String recipient() {
            return recipient;
        }

        String payload() {
            return payload;
        }

        WalletUtxo nextTopUp(long coinbaseMaturity) {
            if (candidates == null) {
                candidates = view.sortedByAmount().iterator();
            }
            while (candidates.hasNext()) {
                WalletUtxo utxo = candidates.next();
                if (used.contains(utxo.outpoint()) || utxo.isImmatureCoinbase(virtualDaaScore, coinbaseMaturity)) {
                    continue;
                }
                if (allowed != null && !allowed.contains(utxo.address())) {
                    continue;
                }
                used.add(utxo.outpoint());
                return utxo;
            }
            return null;
        }
    }
}
