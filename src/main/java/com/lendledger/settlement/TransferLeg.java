package com.lendledger.settlement;

import lombok.Value;

/** One native transfer within a settlement. */
@Value
public class TransferLeg {

    String purpose;
    long amount;
    String from;
    String to;

    public static TransferLeg of(String purpose, long amount, String from, String to) {
        return new TransferLeg(purpose, amount, from, to);
    }

    public TransferLeg reversed() {
        return new TransferLeg(purpose + "-reversal", amount, to, from);
    }
}
