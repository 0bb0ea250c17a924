package com.showapp.show.dto.show.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveResponse {
    // Current show, absent when there has never been one.
    private ShowResponse show;

    private List<Integer> years;
    private Integer year;

    @JsonProperty("object_list")
    private List<ShowResponse> objectList;
}
