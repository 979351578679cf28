package com.gateproof.audit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.gateproof.receipt.Receipt;

public class InMemoryAppendOnlyLog implements AppendOnlyLog {
    private final List<Receipt> receipts = new ArrayList<>();
    private final Map<String, Receipt> receiptsById = new HashMap<>();

    @Override
    public synchronized boolean append(Receipt receipt) {
        if (receiptsById.putIfAbsent(receipt.receiptId(), receipt) != null) {
            return false;
        }
        receipts.add(receipt);
        return true;
    }

    @Override
    public synchronized List<Receipt> read(long fromInclusive, long toExclusive) {
        int from = (int) Math.max(0, Math.min(fromInclusive, receipts.size()));
        int to = (int) Math.max(from, Math.min(toExclusive, receipts.size()));
        return List.copyOf(receipts.subList(from, to));
    }

    @Override
    public synchronized Optional<Receipt> find(String receiptId) {
        return Optional.ofNullable(receiptsById.get(receiptId));
    }

    @Override
    public synchronized long size() {
        return receipts.size();
    }
}
