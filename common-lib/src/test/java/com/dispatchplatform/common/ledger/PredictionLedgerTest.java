package com.dispatchplatform.common.ledger;

import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Prediction;
import com.dispatchplatform.common.model.PredictionStats;
import com.dispatchplatform.common.model.PredictionStatus;
import com.dispatchplatform.common.model.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictionLedgerTest {

    private static final Instant T0 = Instant.parse("2025-03-01T22:00:00Z");

    private static Incident incident(long id, String type, String borough, String location, Instant at) {
        return new Incident(id, type, location, borough, Priority.HIGH, type + " reported", "raw",
            "40184", "nyc", at, false, List.of(), List.of(), null, null);
    }

    private static Prediction prediction(String id, String type, String district, Instant createdAt, Instant expiresAt) {
        return Prediction.pending(id, "PROPHET", "Flatbush Ave", district, type, 0.7, "recent cluster",
            createdAt, expiresAt);
    }

    // ── hits ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolve(): hits")
    class HitTests {

        @Test
        @DisplayName("matching incident before expiry marks the prediction hit, correct and total +1 once")
        void robberyInBrooklynHits() {
            Incident a = incident(1, "robbery", "Brooklyn", "Atlantic Ave", T0);
            Prediction p = prediction("pred_1", "robbery", "Brooklyn", T0.plusSeconds(60), T0.plus(Duration.ofMinutes(30)));
            Incident b = incident(2, "robbery", "Brooklyn", "Fulton St", T0.plus(Duration.ofMinutes(10)));

            PredictionLedger ledger = PredictionLedger.empty().resolve(a, T0).ledger().register(p);
            assertEquals(0, ledger.total());

            LedgerUpdate update = ledger.resolve(b, b.createdAt());
            PredictionLedger after = update.ledger();

            assertEquals(1, update.hits().size());
            Prediction hit = update.hits().get(0);
            assertEquals(PredictionStatus.HIT, hit.status());
            assertEquals(2L, hit.matchedIncidentId());
            assertEquals(1, after.correct());
            assertEquals(1, after.total());
            assertTrue(after.pending().isEmpty(), "hit prediction must stop being tracked");

            // the same incident processed again must not count twice
            LedgerUpdate replay = after.resolve(b, b.createdAt());
            assertTrue(replay.hits().isEmpty());
            assertEquals(1, replay.ledger().correct());
            assertEquals(1, replay.ledger().total());
        }

        @Test
        @DisplayName("incident type containing the predicted type matches, location match stands in for district")
        void looseTypeAndLocationMatch() {
            Prediction p = prediction("pred_2", "robbery", "Queens", T0, T0.plus(Duration.ofHours(1)));
            Incident armed = incident(5, "Armed Robbery", "Brooklyn", "Flatbush Ave & Church Ave",
                T0.plusSeconds(600));
            assertTrue(p.matches(armed));
        }

        @Test
        @DisplayName("different type never hits")
        void typeMismatchNoHit() {
            PredictionLedger ledger = PredictionLedger.empty()
                .register(prediction("pred_3", "burglary", "Brooklyn", T0, T0.plus(Duration.ofHours(1))));
            LedgerUpdate update = ledger.resolve(incident(7, "assault", "Brooklyn", "Fulton St", T0.plusSeconds(5)),
                T0.plusSeconds(5));
            assertTrue(update.hits().isEmpty());
            assertEquals(1, update.ledger().pending().size());
        }

        @Test
        @DisplayName("a shorter incident type does not satisfy a more specific forecast")
        void typeContainmentIsOneWay() {
            Prediction p = prediction("pred_6", "Structure Fire", "Brooklyn", T0, T0.plus(Duration.ofHours(1)));

            assertFalse(p.matches(incident(8, "Fire", "Brooklyn", "Flatbush Ave", T0.plusSeconds(60))));
            assertTrue(p.matches(incident(9, "Structure Fire 2nd Alarm", "Brooklyn", "Fulton St", T0.plusSeconds(60))));
        }

        @Test
        @DisplayName("a forecast with an Unknown district is not hit by an incident with no known place")
        void unknownPlacesNeverMatch() {
            Prediction p = prediction("pred_7", "Robbery", Incident.UNKNOWN, T0, T0.plus(Duration.ofHours(6)));
            PredictionLedger ledger = PredictionLedger.empty().register(p);

            LedgerUpdate update = ledger.resolve(
                incident(10, "Robbery", Incident.UNKNOWN, Incident.UNKNOWN, T0.plusSeconds(300)), T0.plusSeconds(300));

            assertTrue(update.hits().isEmpty());
            assertEquals(0, update.ledger().correct());
            assertEquals(1, update.ledger().pending().size());
        }

        @Test
        @DisplayName("blank places on either side never count as a place match")
        void blankPlacesNeverMatch() {
            Prediction blank = Prediction.pending("pred_8", "PROPHET", " ", "", "Robbery", 0.7, "",
                T0, T0.plus(Duration.ofHours(1)));

            assertFalse(blank.matches(incident(11, "Robbery", "", " ", T0.plusSeconds(60))));
            assertFalse(blank.matches(incident(12, "Robbery", "Brooklyn", "Flatbush Ave", T0.plusSeconds(60))));
        }

        @Test
        @DisplayName("recordHit on an unknown id leaves the ledger unchanged")
        void unknownIdIgnored() {
            PredictionLedger ledger = PredictionLedger.empty();
            LedgerUpdate update = ledger.recordHit("missing", 1, T0);
            assertSame(ledger, update.ledger());
            assertFalse(update.changed());
        }
    }

    // ── expiry ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("overdue prediction expires and is removed; correct does not change")
        void overdueExpires() {
            Prediction p = prediction("pred_4", "robbery", "Brooklyn", T0, T0.plus(Duration.ofMinutes(30)));
            PredictionLedger ledger = PredictionLedger.empty().register(p);

            LedgerUpdate update = ledger.expireDue(T0.plus(Duration.ofMinutes(31)));

            assertEquals(1, update.expired().size());
            assertEquals(PredictionStatus.EXPIRED, update.expired().get(0).status());
            assertTrue(update.ledger().pending().isEmpty());
            assertEquals(0, update.ledger().correct());
            assertEquals(1, update.ledger().total());
        }

        @Test
        @DisplayName("a late matching incident expires the prediction instead of hitting it")
        void expiryCheckedBeforeMatching() {
            Prediction p = prediction("pred_5", "robbery", "Brooklyn", T0, T0.plus(Duration.ofMinutes(30)));
            Incident late = incident(9, "robbery", "Brooklyn", "Fulton St", T0.plus(Duration.ofMinutes(45)));

            LedgerUpdate update = PredictionLedger.empty().register(p).resolve(late, late.createdAt());

            assertTrue(update.hits().isEmpty());
            assertEquals(1, update.expired().size());
            assertEquals(0, update.ledger().correct());
        }

        @Test
        @DisplayName("not yet due predictions stay pending")
        void notDueStaysPending() {
            Prediction p = prediction("pred_6", "robbery", "Brooklyn", T0, T0.plus(Duration.ofMinutes(30)));
            LedgerUpdate update = PredictionLedger.empty().register(p).expireDue(T0.plus(Duration.ofMinutes(30)));
            assertTrue(update.expired().isEmpty());
            assertEquals(1, update.ledger().pending().size());
        }

        @Test
        @DisplayName("a resolved prediction cannot transition again")
        void terminalStates() {
            Prediction p = prediction("pred_7", "robbery", "Brooklyn", T0, T0.plusSeconds(60));
            Prediction hit = p.hit(3, T0);
            assertThrows(IllegalStateException.class, () -> hit.expire(T0));
            assertThrows(IllegalStateException.class, () -> p.expire(T0).hit(4, T0));
        }
    }

    // ── stats ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("stats()")
    class StatsTests {

        @Test
        @DisplayName("accuracy is zero before anything resolves")
        void emptyAccuracy() {
            assertEquals(0.0, PredictionLedger.empty().stats().accuracy());
        }

        @Test
        @DisplayName("accuracy equals correct/total exactly and is stable across repeated calls")
        void accuracyExact() {
            PredictionLedger ledger = PredictionLedger.empty()
                .register(prediction("h1", "robbery", "Brooklyn", T0, T0.plus(Duration.ofHours(2))))
                .register(prediction("h2", "robbery", "Brooklyn", T0, T0.plus(Duration.ofHours(2))))
                .register(prediction("e1", "arson", "Bronx", T0, T0.plusSeconds(10)));

            ledger = ledger.recordHit("h1", 11, T0.plusSeconds(5)).ledger();
            ledger = ledger.expireDue(T0.plusSeconds(20)).ledger();
            ledger = ledger.recordHit("h2", 12, T0.plusSeconds(30)).ledger();

            PredictionStats first = ledger.stats();
            PredictionStats second = ledger.stats();
            assertEquals(3, first.total());
            assertEquals(2, first.correct());
            assertEquals(2.0 / 3.0, first.accuracy());
            assertEquals(first.accuracy(), second.accuracy());
            assertEquals(67, first.accuracyPercent());
        }

        @Test
        @DisplayName("transitions never mutate the receiver")
        void immutability() {
            PredictionLedger base = PredictionLedger.empty()
                .register(prediction("p", "robbery", "Brooklyn", T0, T0.plusSeconds(60)));
            base.recordHit("p", 1, T0);
            assertEquals(1, base.pending().size());
            assertEquals(0, base.total());
        }
    }
}
