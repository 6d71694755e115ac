package com.lendledger.domain.vo;

import com.lendledger.domain.enums.AssetKind;
import lombok.Value;

/**
 * Identifies an asset by kind plus an optional registry reference (token contract or
 * collection id). The native asset never carries a reference. Used as the key of the
 * utilization store, so equality covers both fields.
 */
@Value
public class AssetRef {

    AssetKind kind;
    String reference;

    private static final AssetRef NATIVE = new AssetRef(AssetKind.NATIVE, null);

    public static AssetRef nativeAsset() {
        return NATIVE;
    }

    public static AssetRef token(String reference) {
        return new AssetRef(AssetKind.TOKEN, reference);
    }

    public static AssetRef collection(String reference) {
        return new AssetRef(AssetKind.COLLECTIBLE, reference);
    }

    public static AssetRef of(AssetKind kind, String reference) {
        return kind == AssetKind.NATIVE && reference == null ? NATIVE : new AssetRef(kind, reference);
    }

    public boolean isNative() {
        return kind == AssetKind.NATIVE;
    }

    @Override
    public String toString() {
        return reference == null ? kind.name() : kind.name() + ":" + reference;
    }
}
