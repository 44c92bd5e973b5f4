package com.fleetinsight.enrichment.store;

import com.fleetinsight.domain.EnrichedGpsPoint;
import com.fleetinsight.domain.EnrichedGpsPointRepository;
import com.fleetinsight.domain.EnrichedTripRecord;
import com.fleetinsight.domain.EnrichedTripRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichedRecordStoreTest {

    @Mock
    private EnrichedGpsPointRepository gpsRepository;
    @Mock
    private EnrichedTripRecordRepository tripRepository;

    @InjectMocks
    private EnrichedRecordStore store;

    @Test
    @DisplayName("saveGps: one failing write is skipped, the others are saved and counted")
    void saveGps_isolatesFailures() {
        EnrichedGpsPoint a = EnrichedGpsPoint.builder().originalId("a").build();
        EnrichedGpsPoint b = EnrichedGpsPoint.builder().originalId("b").build();
        EnrichedGpsPoint c = EnrichedGpsPoint.builder().originalId("c").build();
        when(gpsRepository.save(any(EnrichedGpsPoint.class))).thenAnswer(inv -> {
            EnrichedGpsPoint p = inv.getArgument(0);
            if ("b".equals(p.getOriginalId())) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return p;
        });

        int saved = store.saveGps(List.of(a, b, c));

        assertThat(saved).isEqualTo(2);
        verify(gpsRepository, times(3)).save(any(EnrichedGpsPoint.class));
    }

    @Test
    @DisplayName("saveTrips returns the number of records written")
    void saveTrips_countsWrites() {
        EnrichedTripRecord trip = EnrichedTripRecord.builder().durationMin(5).distanceKm(1).build();
        when(tripRepository.save(any(EnrichedTripRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(store.saveTrips(List.of(trip, trip))).isEqualTo(2);
        assertThat(store.saveTrips(List.of())).isZero();
    }
}
