package com.lendledger.domain.enums;

/**
 * Kind of asset a loan is denominated in or collateralized with.
 * NATIVE moves through the transfer service; TOKEN and COLLECTIBLE are registry-backed
 * and move through the external asset hook.
 */
public enum AssetKind {
    NATIVE,
    TOKEN,
    COLLECTIBLE;

    public boolean requiresReference() {
        return this != NATIVE;
    }
}
