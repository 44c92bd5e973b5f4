package com.fleetinsight.enrichment.pipeline;

import com.fleetinsight.domain.ActivityLabel;
import com.fleetinsight.domain.AreaLabel;
import com.fleetinsight.domain.ClassificationSource;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.PriceLabel;
import com.fleetinsight.domain.RawGpsPoint;
import com.fleetinsight.domain.RawTripRecord;
import com.fleetinsight.domain.TripLengthLabel;
import com.fleetinsight.enrichment.classifier.RuleBasedClassifier;
import com.fleetinsight.enrichment.oracle.OracleAnswer;
import com.fleetinsight.enrichment.oracle.OracleClassifier;
import com.fleetinsight.enrichment.oracle.OracleOutcome;
import com.fleetinsight.enrichment.oracle.OraclePromptFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Enriches raw GPS points and taxi trips one record at a time: oracle first, rule-based labels when the
 * oracle call fails. Output has the same length and order as the input batch; no record is dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnrichmentEngine {

    static final String ERROR_PREFIX = "Error processing: ";

    private final OracleClassifier oracleClassifier;
    private final OraclePromptFactory oraclePromptFactory;
    private final RuleBasedClassifier ruleBasedClassifier;
    private final Clock clock;

    public List<EnrichedGpsPoint> enrichGps(List<RawGpsPoint> batch) {
        List<EnrichedGpsPoint> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            RawGpsPoint point = batch.get(i);
            OracleOutcome outcome = oracleClassifier.ask(oraclePromptFactory.gpsPrompt(point, i));
            if (outcome.isFailed()) {
                log.debug("GPS point {} ({}) classified by rules: {}", i, point.id(), outcome.getFailureReason());
                out.add(gpsFallback(point, outcome.getFailureReason()));
            } else {
                out.add(gpsFromAnswer(point, outcome.getAnswer().orElseThrow()));
            }
        }
        return out;
    }

    public List<EnrichedTripRecord> enrichTrips(List<RawTripRecord> batch) {
        List<EnrichedTripRecord> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            RawTripRecord trip = batch.get(i);
            OracleOutcome outcome = oracleClassifier.ask(oraclePromptFactory.tripPrompt(trip, i));
            if (outcome.isFailed()) {
                log.debug("Taxi trip {} classified by rules: {}", i, outcome.getFailureReason());
                out.add(tripFallback(trip, outcome.getFailureReason()));
            } else {
                out.add(tripFromAnswer(trip, outcome.getAnswer().orElseThrow()));
            }
        }
        return out;
    }

    private EnrichedGpsPoint gpsFromAnswer(RawGpsPoint point, OracleAnswer answer) {
        return gpsBase(point)
                .areaLabel(answer.text(OraclePromptFactory.AREA_KEY).flatMap(AreaLabel::fromLabel).orElse(null))
                .activityLabel(answer.text(OraclePromptFactory.ACTIVITY_KEY).flatMap(ActivityLabel::fromLabel).orElse(null))
                .roadType(answer.text(OraclePromptFactory.ROAD_TYPE_KEY).map(String::strip).orElse(null))
                .insights(answer.insights().orElse(null))
                .confidence(answer.confidence().orElse(null))
                .classificationSource(sourceOf(answer))
                .build();
    }

    private EnrichedGpsPoint gpsFallback(RawGpsPoint point, String reason) {
        return gpsBase(point)
                .areaLabel(ruleBasedClassifier.area(point.latitude()))
                .activityLabel(ruleBasedClassifier.activity(point.speed()))
                .roadType(RuleBasedClassifier.UNKNOWN_ROAD_TYPE)
                .insights(ERROR_PREFIX + reason)
                .classificationSource(ClassificationSource.FALLBACK)
                .build();
    }

    private EnrichedGpsPoint.EnrichedGpsPointBuilder gpsBase(RawGpsPoint point) {
        return EnrichedGpsPoint.builder()
                .originalId(point.id())
                .latitude(point.latitude())
                .longitude(point.longitude())
                .altitude(point.altitude())
                .speed(point.speed())
                .azimuth(point.azimuth())
                .processedAt(Instant.now(clock));
    }

    private EnrichedTripRecord tripFromAnswer(RawTripRecord trip, OracleAnswer answer) {
        return tripBase(trip)
                .tripLengthLabel(answer.text(OraclePromptFactory.TRIP_CATEGORY_KEY).flatMap(TripLengthLabel::fromLabel).orElse(null))
                .priceLabel(answer.text(OraclePromptFactory.PRICE_CATEGORY_KEY).flatMap(PriceLabel::fromLabel).orElse(null))
                .efficiencyScore(answer.number(OraclePromptFactory.EFFICIENCY_KEY)
                        .filter(score -> score >= 0.0 && score <= 1.0)
                        .orElse(null))
                .insights(answer.insights().orElse(null))
                .confidence(answer.confidence().orElse(null))
                .classificationSource(sourceOf(answer))
                .build();
    }

    private EnrichedTripRecord tripFallback(RawTripRecord trip, String reason) {
        return tripBase(trip)
                .tripLengthLabel(ruleBasedClassifier.tripLength(trip.durationMin()))
                .priceLabel(ruleBasedClassifier.priceTier(trip.fare(), trip.distanceKm()))
                .efficiencyScore(ruleBasedClassifier.efficiency(trip.speedKph(), trip.durationMin()))
                .insights(ERROR_PREFIX + reason)
                .classificationSource(ClassificationSource.FALLBACK)
                .build();
    }

    private EnrichedTripRecord.EnrichedTripRecordBuilder tripBase(RawTripRecord trip) {
        return EnrichedTripRecord.builder()
                .durationSec(trip.durationSec())
                .durationMin(trip.durationMin())
                .distanceKm(trip.distanceKm())
                .speedKph(trip.speedKph())
                .waitCost(trip.waitCost())
                .distanceCost(trip.distanceCost())
                .fare(trip.fare())
                .passengerCount(trip.passengerCount())
                .surgeApplied(trip.surgeApplied())
                .processedAt(Instant.now(clock));
    }

    private static ClassificationSource sourceOf(OracleAnswer answer) {
        return answer.isStructured() ? ClassificationSource.ORACLE : ClassificationSource.ORACLE_UNSTRUCTURED;
    }
}
