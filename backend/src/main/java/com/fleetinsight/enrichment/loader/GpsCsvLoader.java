package com.fleetinsight.enrichment.loader;

import com.fleetinsight.domain.RawGpsPoint;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * GPS export: randomized_id, lat, lng, alt, spd (m/s), azm. Rows without an id use their row index.
 */
@Component
public class GpsCsvLoader extends CsvRecordLoader<RawGpsPoint> {

    @Override
    protected RawGpsPoint mapRow(Map<String, String> row, int rowIndex) {
        String id = row.get("randomized_id");
        return new RawGpsPoint(
                id != null && !id.isBlank() ? id.strip() : String.valueOf(rowIndex),
                requireDouble(row, "lat"),
                requireDouble(row, "lng"),
                requireDouble(row, "alt"),
                requireDouble(row, "spd"),
                requireDouble(row, "azm"));
    }
}
