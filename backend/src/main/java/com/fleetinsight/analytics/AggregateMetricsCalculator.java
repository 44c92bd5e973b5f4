package com.fleetinsight.analytics;

import com.fleetinsight.common.RunningMean;
import com.fleetinsight.common.SafeRatio;
import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedGpsPointRepository;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.EnrichedTripRecordRepository;
import com.fleetinsight.domain.MetricKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Computes fleet summary metrics over the whole persisted corpus in one pass per collection.
 * Every ratio over an empty set is 0.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AggregateMetricsCalculator {

    static final double MPS_TO_KMH = 3.6;
    /** Fixed USD → KZT conversion. */
    static final double USD_TO_TENGE = 541.0;

    private final EnrichedGpsPointRepository gpsRepository;
    private final EnrichedTripRecordRepository tripRepository;
    private final Clock clock;

    public AggregateMetrics computeAggregates() {
        long gpsCount = 0;
        RunningMean movingSpeed = new RunningMean();
        try (Stream<EnrichedGpsPoint> points = gpsRepository.streamAllBy()) {
            for (Iterator<EnrichedGpsPoint> it = points.iterator(); it.hasNext(); ) {
                EnrichedGpsPoint point = it.next();
                gpsCount++;
                if (point.getSpeed() > 0) {
                    movingSpeed.add(point.getSpeed());
                }
            }
        }

        long tripCount = 0;
        long surgeTrips = 0;
        RunningMean fare = new RunningMean();
        RunningMean duration = new RunningMean();
        RunningMean distance = new RunningMean();
        try (Stream<EnrichedTripRecord> trips = tripRepository.streamAllBy()) {
            for (Iterator<EnrichedTripRecord> it = trips.iterator(); it.hasNext(); ) {
                EnrichedTripRecord trip = it.next();
                tripCount++;
                fare.add(trip.getFare());
                duration.add(trip.getDurationMin());
                distance.add(trip.getDistanceKm());
                if (trip.isSurgeApplied()) {
                    surgeTrips++;
                }
            }
        }

        double avgSpeedMps = movingSpeed.mean();
        double avgFareUsd = fare.mean();
        double avgFareTenge = avgFareUsd * USD_TO_TENGE;
        double avgDistanceKm = distance.mean();

        AggregateMetrics metrics = AggregateMetrics.builder(clock.instant())
                .put(AggregateMetrics.GPS_POINTS_COUNT, gpsCount, MetricKind.GPS,
                        "Number of processed GPS points")
                .put(AggregateMetrics.AVG_SPEED_MPS, avgSpeedMps, MetricKind.GPS,
                        "Average speed of moving GPS points, m/s")
                .put(AggregateMetrics.AVG_SPEED_KMH, avgSpeedMps * MPS_TO_KMH, MetricKind.CALCULATED,
                        "Average speed of moving GPS points, km/h")
                .put(AggregateMetrics.TAXI_TRIPS_COUNT, tripCount, MetricKind.TAXI,
                        "Number of processed taxi trips")
                .put(AggregateMetrics.AVG_FARE_USD, avgFareUsd, MetricKind.TAXI,
                        "Average fare, USD")
                .put(AggregateMetrics.AVG_FARE_TENGE, avgFareTenge, MetricKind.CALCULATED,
                        "Average fare, tenge")
                .put(AggregateMetrics.AVG_TRIP_DURATION_MIN, duration.mean(), MetricKind.TAXI,
                        "Average trip duration, minutes")
                .put(AggregateMetrics.AVG_DISTANCE_KM, avgDistanceKm, MetricKind.TAXI,
                        "Average trip distance, km")
                .put(AggregateMetrics.SURGE_PERCENTAGE, SafeRatio.percentOrZero(surgeTrips, tripCount),
                        MetricKind.CALCULATED, "Share of trips with surge pricing, %")
                .put(AggregateMetrics.PRICE_PER_KM_TENGE, SafeRatio.divideOrZero(avgFareTenge, avgDistanceKm),
                        MetricKind.CALCULATED, "Average fare per km, tenge")
                .build();
        log.info("Aggregates computed over {} GPS point(s) and {} taxi trip(s)", gpsCount, tripCount);
        return metrics;
    }
}
