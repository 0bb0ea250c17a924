package com.showapp.show.service;

import com.showapp.show.application.resolution.DateParser;
import com.showapp.show.application.resolution.ResolutionContext;
import com.showapp.show.config.ShowProperties;
import com.showapp.show.domain.show.Show;
import com.showapp.show.dto.show.response.ShowResponse;
import org.springframework.stereotype.Component;

@Component
public class ShowResponseMapper {

    private final ShowProperties properties;

    public ShowResponseMapper(ShowProperties properties) {
        this.properties = properties;
    }

    public ShowResponse toShowResponse(Show show, ResolutionContext context) {
        return ShowResponse.builder()
                .id(show.getId())
                .date(DateParser.formatCanonical(show.airDate(properties.timeZone())))
                .showtime(show.getShowtime())
                .end(show.getEnd())
                .inProgress(show.isInProgressAt(context.now()))
                .build();
    }
}
