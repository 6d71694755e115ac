package com.lendledger.asset;

import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.SupportedToken;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import com.lendledger.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Whitelist of non-native assets the ledger accepts as loan asset or collateral.
 *
 * <p>Two registries are kept: fungible tokens and collectible collections, each keyed by
 * reference. Entries are never removed; disabling flips {@code enabled} so loans already
 * written against the asset keep a resolvable reference. Writes come only from
 * {@link com.lendledger.admin.PlatformAdminService}.
 */
@Component
public class AssetRegistry {

    private static final Logger log = LoggerFactory.getLogger(AssetRegistry.class);

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("[A-Za-z0-9._:\\-]{1,128}");

    private final Map<String, SupportedToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, SupportedCollection> collections = new ConcurrentHashMap<>();

    // ========================
    // VALIDATION
    // ========================

    /**
     * Checks that the asset can be used by a new loan.
     *
     * @throws LedgerException INVALID_TOKEN_CONTRACT for a malformed or misplaced reference,
     *     NOT_FOUND for an unregistered one, UNSUPPORTED_ASSET for a disabled one
     */
    public void requireUsable(AssetRef asset) {
        switch (asset.getKind()) {
            case NATIVE -> {
                if (asset.getReference() != null) {
                    throw new LedgerException(
                            ErrorCode.INVALID_TOKEN_CONTRACT, "Native asset must not carry a reference");
                }
            }
            case TOKEN -> {
                SupportedToken token = findToken(requireWellFormed(asset.getReference()))
                        .orElseThrow(() -> new ResourceNotFoundException("Token", asset.getReference()));
                if (!token.isEnabled()) {
                    throw new LedgerException(
                            ErrorCode.UNSUPPORTED_ASSET, "Token is disabled: " + token.getReference());
                }
            }
            case COLLECTIBLE -> requireEnabledCollection(asset.getReference());
        }
    }

    /** Returns the enabled collection, used to value collectible collateral at its floor price. */
    public SupportedCollection requireEnabledCollection(String reference) {
        SupportedCollection collection = findCollection(requireWellFormed(reference))
                .orElseThrow(() -> new ResourceNotFoundException("Collection", reference));
        if (!collection.isEnabled()) {
            throw new LedgerException(ErrorCode.UNSUPPORTED_ASSET, "Collection is disabled: " + reference);
        }
        return collection;
    }

    public String requireWellFormed(String reference) {
        if (reference == null || !REFERENCE_PATTERN.matcher(reference).matches()) {
            throw new LedgerException(ErrorCode.INVALID_TOKEN_CONTRACT, "Malformed asset reference: " + reference);
        }
        return reference;
    }

    // ========================
    // WRITES
    // ========================

    public void putToken(SupportedToken token) {
        SupportedToken previous = tokens.put(token.getReference(), token.toBuilder().build());
        log.info("{} token {}: {}", previous == null ? "Registered" : "Updated", token.getReference(), token);
    }

    public void putCollection(SupportedCollection collection) {
        SupportedCollection previous = collections.put(collection.getReference(), collection.toBuilder().build());
        log.info(
                "{} collection {}: {}",
                previous == null ? "Registered" : "Updated",
                collection.getReference(),
                collection);
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<SupportedToken> findToken(String reference) {
        return Optional.ofNullable(tokens.get(reference)).map(t -> t.toBuilder().build());
    }

    public Optional<SupportedCollection> findCollection(String reference) {
        return Optional.ofNullable(collections.get(reference)).map(c -> c.toBuilder().build());
    }

    public List<SupportedToken> getTokens() {
        List<SupportedToken> result = new ArrayList<>();
        tokens.values().forEach(t -> result.add(t.toBuilder().build()));
        result.sort(Comparator.comparing(SupportedToken::getReference));
        return result;
    }

    public List<SupportedCollection> getCollections() {
        List<SupportedCollection> result = new ArrayList<>();
        collections.values().forEach(c -> result.add(c.toBuilder().build()));
        result.sort(Comparator.comparing(SupportedCollection::getReference));
        return result;
    }
}
