package com.showapp.show.service;

import com.showapp.show.application.resolution.DefaultShowPolicy;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.dto.common.ApiResponse;
import com.showapp.show.dto.show.response.ArchiveResponse;
import com.showapp.show.dto.show.response.ShowResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ArchiveService {

    private final YearIndexer yearIndexer;
    private final ShowLocator showLocator;
    private final ShowResponseMapper showResponseMapper;

    public ArchiveService(YearIndexer yearIndexer, ShowLocator showLocator, ShowResponseMapper showResponseMapper) {
        this.yearIndexer = yearIndexer;
        this.showLocator = showLocator;
        this.showResponseMapper = showResponseMapper;
    }

    public ApiResponse<ArchiveResponse> getArchive(Integer requestedYear, boolean excludeCurrent, ResolutionContext context) {
        int year = yearIndexer.resolveYear(requestedYear, excludeCurrent, context);
        List<Integer> years = yearIndexer.listYears(excludeCurrent, context);

        List<ShowResponse> shows = yearIndexer.listForYear(year, excludeCurrent, context).stream()
                .map(show -> showResponseMapper.toShowResponse(show, context))
                .toList();

        ShowResponse current = showLocator.find(null, DefaultShowPolicy.IN_PROGRESS_OR_MOST_RECENT_COMPLETED, context)
                .map(show -> showResponseMapper.toShowResponse(show, context))
                .orElse(null);

        log.debug("Archive for {}: {} shows across years {}", year, shows.size(), years);

        ArchiveResponse archive = ArchiveResponse.builder()
                .show(current)
                .years(years)
                .year(year)
                .objectList(shows)
                .build();

        return ApiResponse.ok("Archive loaded", archive);
    }
}
