package tech.andrefsramos.biz_radar.core.domain;

import java.time.Instant;

/*
 * Registro de uma varredura. Nasce em RUNNING e é finalizado exatamente uma vez;
 * {@link #complete} recusa finalizar um registro que já saiu de RUNNING.
 */
public record ScanRecord(
        Long id,
        Instant startedAt,
        Instant finishedAt,
        ScanOutcome outcome,
        int fetchedCount,
        int newCount,
        int changedCount,
        int removedCount,
        String errorKind,
        String errorDetail
) {
    public static ScanRecord running(Instant startedAt) {
        return new ScanRecord(null, startedAt, null, ScanOutcome.RUNNING, 0, 0, 0, 0, null, null);
    }

    public ScanRecord complete(Instant finishedAt, ScanOutcome outcome, int fetched, int created, int changed,
                               int removed, String errorKind, String errorDetail) {
        if (this.outcome != ScanOutcome.RUNNING) {
            throw new IllegalStateException("ScanRecord já finalizado com outcome=" + this.outcome);
        }
        if (outcome == null || !outcome.isFinal()) {
            throw new IllegalArgumentException("Outcome final inválido: " + outcome);
        }
        return new ScanRecord(id, startedAt, finishedAt, outcome, fetched, created, changed, removed, errorKind, errorDetail);
    }

    public ScanRecord withId(Long newId) {
        return new ScanRecord(newId, startedAt, finishedAt, outcome, fetchedCount, newCount, changedCount,
                removedCount, errorKind, errorDetail);
    }
}
