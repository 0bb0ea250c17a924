package com.showapp.show.dto.show.response;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ShowDetailResponse {
    private ShowResponse show;
}
