package org.moxie.attestgate.ledger;

public record LedgerBlock(long number, String hash, long timestamp) {}
