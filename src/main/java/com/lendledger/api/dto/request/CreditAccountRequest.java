package com.lendledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditAccountRequest {

    @NotBlank(message = "Account is required")
    private String account;

    @NotNull(message = "Amount is required")
    private Long amount;
}
