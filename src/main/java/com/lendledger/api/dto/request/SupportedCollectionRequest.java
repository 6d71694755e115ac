package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering or updating a collectible collection. {@code enabled} is
 * only read on update; registration always enables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupportedCollectionRequest {

    @NotBlank(message = "Collection reference is required")
    private String collectionRef;

    @NotNull(message = "Floor price is required")
    private Long floorPrice;

    @NotNull(message = "Risk score is required")
    private Integer riskScore;

    @Builder.Default
    private Boolean enabled = Boolean.TRUE;
}
