package com.gateproof.audit;

import java.util.List;

public record IntegrityReport(long receiptsChecked, long batchesChecked, List<String> failures) {
    public IntegrityReport {
        failures = List.copyOf(failures);
    }

    public boolean intact() {
        return failures.isEmpty();
    }
}
