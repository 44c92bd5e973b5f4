package com.fleetinsight.enrichment.oracle;

import com.fleetinsight.domain.RawGpsPoint;
import com.fleetinsight.domain.RawTripRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds the per-record prompts. Each prompt carries the record's fields, a short positional context and
 * the JSON key set the engine reads back.
 */
@Component
public class OraclePromptFactory {

    public static final String AREA_KEY = "area_classification";
    public static final String ACTIVITY_KEY = "activity_level";
    public static final String ROAD_TYPE_KEY = "road_type";
    public static final String TRIP_CATEGORY_KEY = "trip_category";
    public static final String PRICE_CATEGORY_KEY = "price_category";
    public static final String EFFICIENCY_KEY = "efficiency_score";

    private static final String GPS_TEMPLATE = """
            Analyze this GPS data point and provide insights:
            Latitude: %s
            Longitude: %s
            Altitude: %s
            Speed: %s m/s
            Azimuth: %s
            Context: %s

            Please provide:
            1. Area classification (North/Center/South based on latitude)
            2. Activity level (High/Medium/Low based on speed and context)
            3. Road type prediction (Highway/Street/Residential)
            4. Any interesting patterns or insights

            Return as JSON with keys: area_classification, activity_level, road_type, insights
            """;

    private static final String TRIP_TEMPLATE = """
            Analyze this taxi trip data and provide insights:
            Duration: %s minutes
            Distance: %s km
            Speed: %s km/h
            Fare: %s USD
            Passengers: %d
            Surge pricing: %s
            Context: %s

            Please provide:
            1. Trip category (Short/Medium/Long based on duration and distance)
            2. Price category (Low/Medium/High/Premium based on fare per km)
            3. Time efficiency score (0-1 based on speed and duration)
            4. Any interesting patterns or insights

            Return as JSON with keys: trip_category, price_category, efficiency_score, insights
            """;

    public String gpsPrompt(RawGpsPoint point, int indexInBatch) {
        return GPS_TEMPLATE.formatted(
                point.latitude(), point.longitude(), point.altitude(), point.speed(), point.azimuth(),
                gpsContext(point, indexInBatch));
    }

    public String tripPrompt(RawTripRecord trip, int indexInBatch) {
        return TRIP_TEMPLATE.formatted(
                trip.durationMin(), trip.distanceKm(), trip.speedKph(), trip.fare(), trip.passengerCount(),
                trip.surgeApplied(), tripContext(trip, indexInBatch));
    }

    static String gpsContext(RawGpsPoint point, int indexInBatch) {
        return String.format(Locale.ROOT, "GPS point %d of batch, speed: %.2f m/s", indexInBatch, point.speed());
    }

    static String tripContext(RawTripRecord trip, int indexInBatch) {
        return String.format(Locale.ROOT, "Taxi trip %d of batch, %d passengers", indexInBatch, trip.passengerCount());
    }
}
