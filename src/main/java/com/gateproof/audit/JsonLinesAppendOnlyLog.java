package com.gateproof.audit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gateproof.receipt.Receipt;

/**
 * One JSON receipt per line, appended to a single file. Existing lines are never rewritten.
 *
 * <p>The file is parsed once, on first access; afterwards reads are served from memory and appends
 * update both the file and the cached receipts. The file must not be written by anyone else while an
 * instance is open.
 */
public class JsonLinesAppendOnlyLog implements AppendOnlyLog {
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Path logPath;
    private List<Receipt> receipts;
    private Map<String, Receipt> receiptsById;

    public JsonLinesAppendOnlyLog(Path logPath) {
        this.logPath = Objects.requireNonNull(logPath, "logPath");
    }

    @Override
    public synchronized boolean append(Receipt receipt) throws IOException {
        loadIndex();
        if (receiptsById.containsKey(receipt.receiptId())) {
            return false;
        }
        if (logPath.getParent() != null) {
            Files.createDirectories(logPath.getParent());
        }
        String line = mapper.writeValueAsString(receipt) + System.lineSeparator();
        Files.writeString(logPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        receipts.add(receipt);
        receiptsById.put(receipt.receiptId(), receipt);
        return true;
    }

    @Override
    public synchronized List<Receipt> read(long fromInclusive, long toExclusive) throws IOException {
        loadIndex();
        int from = (int) Math.max(0, Math.min(fromInclusive, receipts.size()));
        int to = (int) Math.max(from, Math.min(toExclusive, receipts.size()));
        return List.copyOf(receipts.subList(from, to));
    }

    @Override
    public synchronized Optional<Receipt> find(String receiptId) throws IOException {
        loadIndex();
        return Optional.ofNullable(receiptsById.get(receiptId));
    }

    @Override
    public synchronized long size() throws IOException {
        loadIndex();
        return receipts.size();
    }

    private void loadIndex() throws IOException {
        if (receipts != null) {
            return;
        }
        List<Receipt> existing = new ArrayList<>();
        Map<String, Receipt> byId = new HashMap<>();
        if (Files.exists(logPath)) {
            for (String line : Files.readAllLines(logPath)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                Receipt receipt = mapper.readValue(line, Receipt.class);
                existing.add(receipt);
                byId.put(receipt.receiptId(), receipt);
            }
        }
        receipts = existing;
        receiptsById = byId;
    }
}
