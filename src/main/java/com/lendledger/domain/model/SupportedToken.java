package com.lendledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Whitelisted fungible token. Disabling keeps the entry so existing loans stay traceable. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupportedToken {

    private String reference;
    private boolean enabled;
    private int decimals;
    private int riskScore;
}
