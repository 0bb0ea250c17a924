package com.showapp.show.controller;

import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.dto.common.ApiResponse;
import com.showapp.show.dto.show.response.ArchiveResponse;
import com.showapp.show.service.ArchiveService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/archive")
public class ArchiveController {

    private final ArchiveService archiveService;

    public ArchiveController(ArchiveService archiveService) {
        this.archiveService = archiveService;
    }

    @GetMapping({"", "/{year}"})
    public ApiResponse<ArchiveResponse> archive(
            @PathVariable(name = "year", required = false) Integer year,
            @RequestParam(name = "excludeCurrent", defaultValue = "true") boolean excludeCurrent,
            @RequestAttribute(ResolutionContext.ATTRIBUTE) ResolutionContext context) {
        return archiveService.getArchive(year, excludeCurrent, context);
    }
}
