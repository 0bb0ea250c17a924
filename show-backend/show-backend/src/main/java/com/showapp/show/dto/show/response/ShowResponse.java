package com.showapp.show.dto.show.response;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ShowResponse {
    private Long id;
    /** Canonical (ISO) air date; the date segment of this show's URL. */
    private String date;
    private Instant showtime;
    private Instant end;
    private boolean inProgress;
}
