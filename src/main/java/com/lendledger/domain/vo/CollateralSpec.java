package com.lendledger.domain.vo;

import com.lendledger.domain.enums.AssetKind;
import lombok.Value;

/**
 * What a borrower posts as collateral. For COLLECTIBLE collateral the amount is the
 * collection floor price captured at creation and {@code itemId} names the pledged item.
 */
@Value
public class CollateralSpec {

    AssetRef asset;
    long amount;
    Long itemId;

    public static CollateralSpec nativeCollateral(long amount) {
        return new CollateralSpec(AssetRef.nativeAsset(), amount, null);
    }

    public static CollateralSpec token(String tokenRef, long amount) {
        return new CollateralSpec(AssetRef.token(tokenRef), amount, null);
    }

    public static CollateralSpec collectible(String collectionRef, long itemId) {
        return new CollateralSpec(AssetRef.collection(collectionRef), 0L, itemId);
    }

    public AssetKind getKind() {
        return asset.getKind();
    }

    /** Same pledge with the amount replaced by its assessed value. */
    public CollateralSpec withAmount(long assessedAmount) {
        return new CollateralSpec(asset, assessedAmount, itemId);
    }
}
