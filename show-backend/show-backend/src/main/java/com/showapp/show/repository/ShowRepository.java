package com.showapp.show.repository;

import com.showapp.show.domain.show.Show;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ShowRepository extends JpaRepository<Show, Long> {

    Optional<Show> findFirstByShowtimeGreaterThanOrderByShowtimeAscIdAsc(Instant instant);

    Optional<Show> findFirstByEndLessThanOrderByEndDescIdAsc(Instant instant);

    Optional<Show> findFirstByShowtimeLessThanEqualAndEndGreaterThanOrderByIdAsc(Instant showtimeBound, Instant endBound);

    Optional<Show> findFirstByOrderByShowtimeDescIdAsc();

    Optional<Show> findFirstByIdNotOrderByShowtimeDescIdAsc(Long excludedId);

    List<Show> findByShowtimeGreaterThanEqualAndShowtimeLessThanOrderByShowtimeDescIdAsc(Instant from, Instant to);

    List<Show> findByShowtimeGreaterThanEqualAndShowtimeLessThanAndIdNotOrderByShowtimeDescIdAsc(
            Instant from,
            Instant to,
            Long excludedId
    );

    // Years are extracted after shifting each showtime into the configured zone.

    @Query(value = """
        select distinct cast(extract(year from (s.showtime at time zone :zone)) as integer) as show_year
        from broadcast_show s
        order by show_year asc
    """, nativeQuery = true)
    List<Integer> findDistinctShowtimeYears(@Param("zone") String zone);

    @Query(value = """
        select distinct cast(extract(year from (s.showtime at time zone :zone)) as integer) as show_year
        from broadcast_show s
        where s.id <> :excludedId
        order by show_year asc
    """, nativeQuery = true)
    List<Integer> findDistinctShowtimeYearsExcluding(@Param("zone") String zone, @Param("excludedId") Long excludedId);

    @Query(value = """
        select cast(extract(year from (s.showtime at time zone :zone)) as integer)
        from broadcast_show s
        order by s.showtime asc
    """, nativeQuery = true)
    List<Integer> findShowtimeYears(@Param("zone") String zone);

    @Query(value = """
        select cast(extract(year from (s.showtime at time zone :zone)) as integer)
        from broadcast_show s
        where s.id <> :excludedId
        order by s.showtime asc
    """, nativeQuery = true)
    List<Integer> findShowtimeYearsExcluding(@Param("zone") String zone, @Param("excludedId") Long excludedId);
}
