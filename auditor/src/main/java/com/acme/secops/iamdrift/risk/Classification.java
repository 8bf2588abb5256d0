package com.acme.secops.iamdrift.risk;

import java.util.Objects;

public record Classification(Severity severity, String ruleId, String rationale) {
    public Classification {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(ruleId, "ruleId");
        rationale = rationale == null ? "" : rationale;
    }
}
