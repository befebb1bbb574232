package com.dispatchplatform.common.ledger;

import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Prediction;
import com.dispatchplatform.common.model.PredictionStats;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable record of a city's predictions and their outcomes.
 *
 * <p>Only pending predictions are held. A prediction leaves the pending list exactly once:
 * on a hit ({@code correct} and {@code total} both advance) or on expiry ({@code total}
 * advances). Both counters are monotonically non-decreasing. Transitions return a new ledger
 * and never modify the receiver.
 */
public final class PredictionLedger {

    private static final PredictionLedger EMPTY = new PredictionLedger(0, 0, List.of());

    private final long total;
    private final long correct;
    private final List<Prediction> pending;

    private PredictionLedger(long total, long correct, List<Prediction> pending) {
        this.total   = total;
        this.correct = correct;
        this.pending = List.copyOf(pending);
    }

    public static PredictionLedger empty() {
        return EMPTY;
    }

    public PredictionLedger register(Prediction prediction) {
        if (!prediction.isPending()) {
            throw new IllegalArgumentException("Only pending predictions can be registered. id=" + prediction.id());
        }
        if (find(prediction.id()).isPresent()) return this;
        List<Prediction> next = new ArrayList<>(pending);
        next.add(prediction);
        return new PredictionLedger(total, correct, next);
    }

    /**
     * Marks a pending prediction as hit by {@code incidentId}. Unknown or already resolved ids
     * leave the ledger unchanged, so a hit is counted at most once.
     */
    public LedgerUpdate recordHit(String predictionId, long incidentId, Instant at) {
        Optional<Prediction> target = find(predictionId);
        if (target.isEmpty()) return unchanged();
        Prediction hit = target.get().hit(incidentId, at);
        PredictionLedger next = new PredictionLedger(total + 1, correct + 1, without(predictionId));
        return new LedgerUpdate(next, List.of(hit), List.of());
    }

    /** Marks a pending prediction as expired. Unknown or already resolved ids are ignored. */
    public LedgerUpdate recordExpiry(String predictionId, Instant at) {
        Optional<Prediction> target = find(predictionId);
        if (target.isEmpty()) return unchanged();
        Prediction expired = target.get().expire(at);
        PredictionLedger next = new PredictionLedger(total + 1, correct, without(predictionId));
        return new LedgerUpdate(next, List.of(), List.of(expired));
    }

    /** Expires every pending prediction whose {@code expiresAt} is before {@code now}. */
    public LedgerUpdate expireDue(Instant now) {
        PredictionLedger ledger = this;
        List<Prediction> expired = new ArrayList<>();
        for (Prediction p : pending) {
            if (p.isExpiredAt(now)) {
                LedgerUpdate update = ledger.recordExpiry(p.id(), now);
                ledger = update.ledger();
                expired.addAll(update.expired());
            }
        }
        return new LedgerUpdate(ledger, List.of(), expired);
    }

    /**
     * Applies a newly created incident: first expires overdue predictions, then marks every
     * remaining pending prediction the incident matches as hit.
     */
    public LedgerUpdate resolve(Incident incident, Instant now) {
        LedgerUpdate afterExpiry = expireDue(now);
        PredictionLedger ledger = afterExpiry.ledger();
        List<Prediction> hits = new ArrayList<>();
        for (Prediction p : ledger.pending) {
            if (p.matches(incident)) {
                LedgerUpdate update = ledger.recordHit(p.id(), incident.id(), now);
                ledger = update.ledger();
                hits.addAll(update.hits());
            }
        }
        return new LedgerUpdate(ledger, hits, afterExpiry.expired());
    }

    public PredictionStats stats() {
        return new PredictionStats(total, correct, accuracy(), pending);
    }

    public double accuracy() {
        return total == 0 ? 0.0 : (double) correct / total;
    }

    public long total() {
        return total;
    }

    public long correct() {
        return correct;
    }

    public List<Prediction> pending() {
        return pending;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Optional<Prediction> find(String predictionId) {
        return pending.stream().filter(p -> p.id().equals(predictionId)).findFirst();
    }

    private List<Prediction> without(String predictionId) {
        return pending.stream().filter(p -> !p.id().equals(predictionId)).toList();
    }

    private LedgerUpdate unchanged() {
        return new LedgerUpdate(this, List.of(), List.of());
    }
}
