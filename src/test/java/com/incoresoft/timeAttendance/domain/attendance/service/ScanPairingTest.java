package com.incoresoft.timeAttendance.domain.attendance.service;

import com.incoresoft.timeAttendance.domain.scan.dto.ScanDirection;
import com.incoresoft.timeAttendance.domain.scan.dto.ScanEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScanPairingTest {

    private static ScanEvent scan(int hour, int minute, ScanDirection direction) {
        return ScanEvent.of(1L, LocalDateTime.of(2025, 1, 13, hour, minute), direction, "dev");
    }

    @Test
    void sumsClosedIntervalsOnly() {
        ScanPairing pairing = ScanPairing.of(List.of(
                scan(9, 0, ScanDirection.CHECK_IN),
                scan(12, 0, ScanDirection.CHECK_OUT),
                scan(13, 0, ScanDirection.CHECK_IN),
                scan(18, 30, ScanDirection.CHECK_OUT)));

        assertThat(pairing.workedMinutes()).isEqualTo(8 * 60 + 30);
        assertThat(pairing.pairCount()).isEqualTo(2);
        assertThat(pairing.firstCheckIn()).isEqualTo(LocalDateTime.of(2025, 1, 13, 9, 0));
        assertThat(pairing.lastCheckOut()).isEqualTo(LocalDateTime.of(2025, 1, 13, 18, 30));
        assertThat(pairing.activeCheckIn()).isFalse();
    }

    @Test
    void secondCheckInKeepsEarliestOpenInterval() {
        ScanPairing pairing = ScanPairing.of(List.of(
                scan(9, 0, ScanDirection.CHECK_IN),
                scan(10, 0, ScanDirection.CHECK_IN),
                scan(17, 0, ScanDirection.CHECK_OUT)));

        assertThat(pairing.workedMinutes()).isEqualTo(8 * 60);
        assertThat(pairing.pairCount()).isEqualTo(1);
    }

    @Test
    void orphanCheckOutIsIgnoredForPairingButSetsBound() {
        ScanPairing pairing = ScanPairing.of(List.of(scan(15, 0, ScanDirection.CHECK_OUT)));

        assertThat(pairing.workedMinutes()).isZero();
        assertThat(pairing.pairCount()).isZero();
        assertThat(pairing.firstCheckIn()).isNull();
        assertThat(pairing.lastCheckOut()).isNotNull();
    }

    @Test
    void trailingCheckInLeavesDayOpen() {
        ScanPairing pairing = ScanPairing.of(List.of(
                scan(9, 0, ScanDirection.CHECK_IN),
                scan(12, 0, ScanDirection.CHECK_OUT),
                scan(13, 0, ScanDirection.CHECK_IN)));

        assertThat(pairing.activeCheckIn()).isTrue();
        assertThat(pairing.workedMinutes()).isEqualTo(180);
    }
}
