package com.walletd.tx;

import com.walletd.address.AddressDirectory;
import com.walletd.config.WalletProperties;
import com.walletd.node.NodeClient;
import com.walletd.utxo.UtxoStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Transaction building parts, sized by the wallet's signature requirements and network parameters.
 */
@Configuration
@EnableConfigurationProperties(WalletProperties.class)
public class TransactionBuilderConfig {

    @Bean
    public SignatureMassEstimator signatureMassEstimator(WalletProperties properties) {
        return new SignatureScriptMassEstimator(properties.getMinimumSignatures());
    }

    @Bean
    public MassCalculator massCalculator(SignatureMassEstimator signatureMassEstimator) {
        return new MassCalculator(signatureMassEstimator);
    }

    @Bean
    public KaspaAddressCodec kaspaAddressCodec(WalletProperties properties) {
        return new KaspaAddressCodec(properties.getAddressPrefix());
    }

    @Bean
    public TransactionFactory transactionFactory(KaspaAddressCodec kaspaAddressCodec, WalletProperties properties) {
        return new TransactionFactory(kaspaAddressCodec, new TransactionIdCalculator(), properties.getMinimumSignatures());
    }

    @Bean
    public UtxoSelector utxoSelector(MassCalculator massCalculator, WalletProperties properties) {
        return new UtxoSelector(massCalculator, properties.getCoinbaseMaturity(), properties.getMinChangeTarget(),
                Math.max(1, properties.getMinimumSignatures()));
    }

    @Bean
    public TransactionGenerator transactionGenerator(AddressDirectory addressDirectory, UtxoStore utxoStore,
                                                     NodeClient nodeClient, FeeEstimator feeEstimator,
                                                     UtxoSelector utxoSelector, TransactionFactory transactionFactory,
                                                     MassCalculator massCalculator, WalletProperties properties) {
        return new TransactionGenerator(addressDirectory, utxoStore, nodeClient, feeEstimator, utxoSelector,
                transactionFactory, massCalculator, properties.getCoinbaseMaturity());
    }
}
