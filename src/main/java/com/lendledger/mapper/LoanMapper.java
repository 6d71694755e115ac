package com.lendledger.mapper;

import com.lendledger.api.dto.response.LoanResponse;
import com.lendledger.domain.model.Loan;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from the Loan domain model to the flat LoanResponse DTO.
 *
 * <p>The nested AssetRef and CollateralSpec value objects are flattened; {@code dueAt}
 * comes from the derived {@link Loan#getDueAt()}.
 */
@Mapper
public interface LoanMapper {

    @Mapping(source = "loanAsset.kind", target = "loanAssetKind")
    @Mapping(source = "loanAsset.reference", target = "loanAssetRef")
    @Mapping(source = "collateral.asset.kind", target = "collateralKind")
    @Mapping(source = "collateral.asset.reference", target = "collateralRef")
    @Mapping(source = "collateral.amount", target = "collateralAmount")
    @Mapping(source = "collateral.itemId", target = "collateralItemId")
    LoanResponse toResponse(Loan loan);
}
