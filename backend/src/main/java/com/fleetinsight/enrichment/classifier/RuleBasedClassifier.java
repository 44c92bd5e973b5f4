package com.fleetinsight.enrichment.classifier;

import com.fleetinsight.domain.ActivityLabel;
import com.fleetinsight.domain.AreaLabel;
import com.fleetinsight.domain.PriceLabel;
import com.fleetinsight.domain.TripLengthLabel;
import org.springframework.stereotype.Component;

/**
 * Deterministic labels used when the oracle is unavailable. Every method is total: NaN fails every
 * comparison and lands in the last branch.
 */
@Component
public class RuleBasedClassifier {

    public static final String UNKNOWN_ROAD_TYPE = "Unknown";

    static final double NORTH_LATITUDE = 51.12;
    static final double SOUTH_LATITUDE = 51.08;
    static final double HIGH_ACTIVITY_MPS = 10.0;
    static final double MEDIUM_ACTIVITY_MPS = 3.0;
    static final double SHORT_TRIP_MIN = 10.0;
    static final double MEDIUM_TRIP_MIN = 30.0;

    /** Exact boundary latitudes go to CENTER. */
    public AreaLabel area(double latitude) {
        if (latitude > NORTH_LATITUDE) {
            return AreaLabel.NORTH;
        }
        if (latitude < SOUTH_LATITUDE) {
            return AreaLabel.SOUTH;
        }
        return AreaLabel.CENTER;
    }

    public ActivityLabel activity(double speedMps) {
        if (speedMps > HIGH_ACTIVITY_MPS) {
            return ActivityLabel.HIGH;
        }
        if (speedMps > MEDIUM_ACTIVITY_MPS) {
            return ActivityLabel.MEDIUM;
        }
        return ActivityLabel.LOW;
    }

    public TripLengthLabel tripLength(double durationMin) {
        if (durationMin < SHORT_TRIP_MIN) {
            return TripLengthLabel.SHORT;
        }
        if (durationMin < MEDIUM_TRIP_MIN) {
            return TripLengthLabel.MEDIUM;
        }
        return TripLengthLabel.LONG;
    }

    /**
     * Tier by fare per km: &lt;2 LOW, &lt;5 MEDIUM, &lt;10 HIGH, else PREMIUM. UNKNOWN when distance is not positive.
     */
    public PriceLabel priceTier(double fare, double distanceKm) {
        if (!(distanceKm > 0)) {
            return PriceLabel.UNKNOWN;
        }
        double rate = fare / distanceKm;
        if (rate < 2) {
            return PriceLabel.LOW;
        }
        if (rate < 5) {
            return PriceLabel.MEDIUM;
        }
        if (rate < 10) {
            return PriceLabel.HIGH;
        }
        return PriceLabel.PREMIUM;
    }

    /**
     * Mean of a speed score (kph / 60, capped at 1) and a duration score (1 at 15 min, 0 at 45 min and
     * beyond). Clamped to [0, 1]; NaN inputs score 0.
     */
    public double efficiency(double speedKph, double durationMin) {
        double speedScore = Math.min(speedKph / 60.0, 1.0);
        double durationScore = Math.max(0.0, 1.0 - (durationMin - 15.0) / 30.0);
        double score = (speedScore + durationScore) / 2.0;
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
