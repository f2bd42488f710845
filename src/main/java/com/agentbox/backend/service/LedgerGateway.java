package com.agentbox.backend.service;

import com.agentbox.backend.entity.enumeration.Asset;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wallet and on-chain identity operations, signed by the custodial hot wallet.
 */
public interface LedgerGateway {

    boolean isConfigured();

    /** Sends {@code amount} base units of {@code asset} from the custodial wallet; returns the tx signature. */
    String transfer(Asset asset, long amount, String to);

    /** Stores the descriptor document and returns its URI. */
    String uploadDescriptor(IdentityDescriptor descriptor);

    /** Registers a new identity token owned by the custodial wallet; returns the mint address. */
    String mintIdentity(IdentityDescriptor descriptor, String uri);

    void transferIdentity(String mint, String newOwner);

    /** Replaces name and/or URI; null leaves a field unchanged. */
    void updateIdentity(String mint, String name, String uri);

    /** Empty when the mint is not a known identity. */
    Optional<IdentityDescriptor> loadIdentity(String mint);

    /** Mints of single-unit, zero-decimal tokens of the identity token program held by the wallet. */
    List<String> ownedTokensOf(String wallet);

    @Value
    @Builder
    class IdentityDescriptor {
        String name;
        String description;
        String image;
        String hostname;
        String agentWallet;
        @Singular("metadata")
        Map<String, String> additionalMetadata;
    }
}
