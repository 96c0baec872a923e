package com.piggyboss.vault.services;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryTokenLedgerTest {

    private static final String VAULT = InMemoryTokenLedger.VAULT_ACCOUNT;

    @Test
    public void testTransferInAndOut_tracksNetFlows() throws TransferException {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(BigInteger.valueOf(500));

        ledger.transferIn("alice", BigInteger.valueOf(60));
        assertEquals(BigInteger.valueOf(-60), ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(560), ledger.balanceOf(VAULT));

        ledger.transferOut("alice", BigInteger.valueOf(70));
        assertEquals(BigInteger.TEN, ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(490), ledger.balanceOf(VAULT));
    }

    @Test
    public void testTransferOut_beyondReserveFailsAndLeavesBalances() throws TransferException {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(BigInteger.ZERO);
        ledger.transferIn("bob", BigInteger.TEN);

        TransferException e = assertThrows(TransferException.class, () -> ledger.transferOut("bob", BigInteger.valueOf(11)));
        assertEquals(TransferException.Reason.INSUFFICIENT_FUNDS, e.getReason());
        assertEquals(BigInteger.TEN, ledger.balanceOf(VAULT));
        assertEquals(BigInteger.valueOf(-10), ledger.balanceOf("bob"));
    }

    @Test
    public void testInvalidTransfer_rejected() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger(null);
        assertEquals(BigInteger.ZERO, ledger.balanceOf(VAULT));
        TransferException zero = assertThrows(TransferException.class, () -> ledger.transferIn("bob", BigInteger.ZERO));
        assertEquals(TransferException.Reason.LEDGER_UNAVAILABLE, zero.getReason());
        assertThrows(TransferException.class, () -> ledger.transferOut(null, BigInteger.ONE));
    }
}
