package com.gateproof.audit;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.gateproof.receipt.Receipt;

/**
 * Write-once, read-many receipt storage.
 */
public interface AppendOnlyLog {
    /**
     * Stores the receipt at the end of the log.
     *
     * @return false when a receipt with the same id is already stored; nothing is written
     */
    boolean append(Receipt receipt) throws IOException;

    /** Receipts at positions {@code [fromInclusive, toExclusive)}, clipped to the log size. */
    List<Receipt> read(long fromInclusive, long toExclusive) throws IOException;

    /** The stored receipt with this id, if any. */
    Optional<Receipt> find(String receiptId) throws IOException;

    long size() throws IOException;
}
