package com.fleetinsight.enrichment.loader;

import com.fleetinsight.domain.RawTripRecord;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Taxi export: trip_duration_sec, trip_duration_min, distance_traveled_Km, KPH, wait_time_cost,
 * distance_cost, total_fare_new, num_of_passengers, surge_applied.
 */
@Component
public class TripCsvLoader extends CsvRecordLoader<RawTripRecord> {

    @Override
    protected RawTripRecord mapRow(Map<String, String> row, int rowIndex) {
        return new RawTripRecord(
                requireLong(row, "trip_duration_sec"),
                requireDouble(row, "trip_duration_min"),
                requireDouble(row, "distance_traveled_Km"),
                requireDouble(row, "KPH"),
                requireDouble(row, "wait_time_cost"),
                requireDouble(row, "distance_cost"),
                requireDouble(row, "total_fare_new"),
                (int) requireLong(row, "num_of_passengers"),
                requireBoolean(row, "surge_applied"));
    }
}
