package com.showapp.show.controller;

import com.showapp.show.application.resolution.DefaultShowPolicy;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.dto.common.ApiResponse;
import com.showapp.show.dto.show.response.ShowDetailResponse;
import com.showapp.show.service.ShowResolution;
import com.showapp.show.service.ShowResolutionService;
import com.showapp.show.service.ShowResponseMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Show pages addressed by air date.
 * <ul>
 *   <li>{@code /api/show[/{date}]}: without a date, the most recently completed show</li>
 *   <li>{@code /api/on-air[/{date}]}: without a date, the show on air now, else the most recently completed one</li>
 * </ul>
 * A date that is not the canonical spelling of a show's air date gets a redirect to it.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ShowController {

    private final ShowResolutionService showResolutionService;
    private final ShowResponseMapper showResponseMapper;
    private final CanonicalRedirects canonicalRedirects;

    public ShowController(
            ShowResolutionService showResolutionService,
            ShowResponseMapper showResponseMapper,
            CanonicalRedirects canonicalRedirects
    ) {
        this.showResolutionService = showResolutionService;
        this.showResponseMapper = showResponseMapper;
        this.canonicalRedirects = canonicalRedirects;
    }

    @GetMapping({"/show", "/show/{date}"})
    public ResponseEntity<?> show(
            @PathVariable(name = "date", required = false) String date,
            @RequestAttribute(ResolutionContext.ATTRIBUTE) ResolutionContext context,
            HttpServletRequest request) {
        return respond(date, DefaultShowPolicy.MOST_RECENT_COMPLETED, context, request);
    }

    @GetMapping({"/on-air", "/on-air/{date}"})
    public ResponseEntity<?> onAir(
            @PathVariable(name = "date", required = false) String date,
            @RequestAttribute(ResolutionContext.ATTRIBUTE) ResolutionContext context,
            HttpServletRequest request) {
        return respond(date, DefaultShowPolicy.IN_PROGRESS_OR_MOST_RECENT_COMPLETED, context, request);
    }

    private ResponseEntity<?> respond(
            String date,
            DefaultShowPolicy policy,
            ResolutionContext context,
            HttpServletRequest request) {
        ShowResolution resolution = showResolutionService.resolve(date, policy, context);

        if (resolution.decision().redirect()) {
            log.info("Redirecting '{}' to canonical date {}", date, resolution.decision().canonicalDate());
            return canonicalRedirects.toCanonicalDate(request, resolution.decision().canonicalDate());
        }

        ShowDetailResponse detail = ShowDetailResponse.builder()
                .show(showResponseMapper.toShowResponse(resolution.show(), context))
                .build();

        return ResponseEntity.ok(ApiResponse.ok("Show loaded", detail));
    }
}
