package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Typed pointer from a journal back to the business event that caused it.
 */
@Value
public class SourceReference {
    SourceKind kind;
    UUID id;

    private SourceReference(SourceKind kind, UUID id) {
        this.kind = Objects.requireNonNull(kind, "Source kind is required");
        this.id = Objects.requireNonNull(id, "Source id is required");
    }

    public static SourceReference of(SourceKind kind, UUID id) {
        return new SourceReference(kind, id);
    }

    public static SourceReference payrollRun(UUID payrollRunId) {
        return new SourceReference(SourceKind.PAYROLL_RUN, payrollRunId);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
