package com.lendledger.unit.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lendledger.asset.AssetRegistry;
import com.lendledger.domain.enums.AssetKind;
import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.SupportedToken;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import com.lendledger.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AssetRegistryTest {

    private AssetRegistry assetRegistry;

    @BeforeEach
    void setUp() {
        assetRegistry = new AssetRegistry();
        assetRegistry.putToken(SupportedToken.builder()
                .reference("USDX")
                .enabled(true)
                .decimals(6)
                .riskScore(2)
                .build());
        assetRegistry.putToken(SupportedToken.builder()
                .reference("OLDX")
                .enabled(false)
                .decimals(18)
                .riskScore(7)
                .build());
        assetRegistry.putCollection(SupportedCollection.builder()
                .reference("PUNKS")
                .enabled(true)
                .floorPrice(5_000_000L)
                .riskScore(5)
                .build());
    }

    @Nested
    @DisplayName("Usability Checks")
    class UsabilityChecks {

        @Test
        @DisplayName("Native asset without reference is always usable")
        void nativeUsable() {
            assertThatCode(() -> assetRegistry.requireUsable(AssetRef.nativeAsset()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Native asset carrying a reference is rejected")
        void nativeWithReference() {
            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.of(AssetKind.NATIVE, "X")))
                    .isInstanceOf(LedgerException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_TOKEN_CONTRACT);
        }

        @Test
        @DisplayName("Malformed token reference is INVALID_TOKEN_CONTRACT")
        void malformedToken() {
            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.token("bad ref!")))
                    .isInstanceOf(LedgerException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_TOKEN_CONTRACT);
            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.token(null)))
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.INVALID_TOKEN_CONTRACT);
        }

        @Test
        @DisplayName("Unregistered token is NOT_FOUND")
        void unknownToken() {
            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.token("NOPE")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Disabled token is UNSUPPORTED_ASSET")
        void disabledToken() {
            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.token("OLDX")))
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.UNSUPPORTED_ASSET);
        }

        @Test
        @DisplayName("Enabled collection resolves with its floor price")
        void enabledCollection() {
            assertThat(assetRegistry.requireEnabledCollection("PUNKS").getFloorPrice())
                    .isEqualTo(5_000_000L);
        }

        @Test
        @DisplayName("Disabled collection is UNSUPPORTED_ASSET")
        void disabledCollection() {
            SupportedCollection punks = assetRegistry.findCollection("PUNKS").orElseThrow();
            punks.setEnabled(false);
            assetRegistry.putCollection(punks);

            assertThatThrownBy(() -> assetRegistry.requireUsable(AssetRef.collection("PUNKS")))
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.UNSUPPORTED_ASSET);
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Lists are sorted by reference")
        void sortedLists() {
            assertThat(assetRegistry.getTokens())
                    .extracting(SupportedToken::getReference)
                    .containsExactly("OLDX", "USDX");
            assertThat(assetRegistry.getCollections())
                    .extracting(SupportedCollection::getReference)
                    .containsExactly("PUNKS");
        }

        @Test
        @DisplayName("Mutating a returned token does not change the registry")
        void findReturnsCopy() {
            assetRegistry.findToken("USDX").orElseThrow().setEnabled(false);

            assertThat(assetRegistry.findToken("USDX").orElseThrow().isEnabled()).isTrue();
        }
    }
}
