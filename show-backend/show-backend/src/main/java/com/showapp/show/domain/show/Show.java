package com.showapp.show.domain.show;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * One airing of the recurring show. Rows are written by the ingestion side;
 * this service only reads them.
 */
@Entity
@Table(
        name = "broadcast_show",
        indexes = {
                @Index(name = "ix_show_showtime", columnList = "showtime"),
                @Index(name = "ix_show_end_time", columnList = "end_time")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Show {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "showtime", nullable = false)
    private Instant showtime;

    @Column(name = "end_time", nullable = false)
    private Instant end;

    /**
     * Calendar date of the showtime in the broadcast zone. This is the date
     * that appears in the show's canonical URL.
     */
    public LocalDate airDate(ZoneId zone) {
        return showtime.atZone(zone).toLocalDate();
    }

    public boolean isInProgressAt(Instant instant) {
        return !showtime.isAfter(instant) && end.isAfter(instant);
    }

    @PrePersist
    @PreUpdate
    void validateInterval() {
        if (showtime == null || end == null) {
            throw new IllegalStateException("Show.showtime and Show.end are required.");
        }
        if (end.isBefore(showtime)) {
            throw new IllegalStateException("Show.end must not be earlier than Show.showtime.");
        }
    }
}
