package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordDto;
import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * HTTP client for the biometric terminal's attendance API.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TerminalApiRepository {
    static final int MAX_PAGES = 1000;

    private final RestTemplate terminal;

    // GET /attendance?limit=...&offset=...&start_date=2025-01-01T08:00:00
    public TerminalRecordsResponse getAttendance(String deviceAddress, LocalDateTime since, int limit, int offset) {
        String url = UriComponentsBuilder
                .fromHttpUrl(deviceAddress)
                .path("/attendance")
                .queryParam("limit", limit)
                .queryParam("offset", offset)
                .queryParamIfPresent("start_date", Optional.ofNullable(since).map(DateTimeFormatter.ISO_LOCAL_DATE_TIME::format))
                .build()
                .toUriString();

        try {
            ResponseEntity<TerminalRecordsResponse> resp =
                    terminal.exchange(url, HttpMethod.GET, null, TerminalRecordsResponse.class);
            return (resp.getBody() != null) ? resp.getBody() : emptyPage();
        } catch (HttpClientErrorException.NotFound nf) {
            return emptyPage();
        }
    }

    /**
     * Fetches every page of records newer than {@code since} (all records when null).
     * Stops on a short page, once the reported total is reached, or after {@link #MAX_PAGES}.
     */
    public List<TerminalRecordDto> getAllAttendanceSince(String deviceAddress, LocalDateTime since, int pageLimit) {
        List<TerminalRecordDto> all = new ArrayList<>();
        int offset = 0;
        for (int pages = 1; ; pages++) {
            TerminalRecordsResponse page = getAttendance(deviceAddress, since, pageLimit, offset);
            List<TerminalRecordDto> data = (page.getData() == null) ? Collections.emptyList() : page.getData();
            all.addAll(data);
            if (data.size() < pageLimit) break; // last page
            offset += pageLimit;
            if (page.getTotal() != null && offset >= page.getTotal()) break;
            if (pages >= MAX_PAGES) {
                log.warn("[SYNC] {} still returning full pages after {} requests, stopping at {} records",
                        deviceAddress, MAX_PAGES, all.size());
                break;
            }
        }
        log.debug("[SYNC] Fetched {} records from {}", all.size(), deviceAddress);
        return all;
    }

    private static TerminalRecordsResponse emptyPage() {
        TerminalRecordsResponse r = new TerminalRecordsResponse();
        r.setData(Collections.emptyList());
        r.setTotal(0);
        return r;
    }
}
