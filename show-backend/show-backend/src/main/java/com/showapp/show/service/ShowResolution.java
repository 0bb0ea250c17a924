package com.showapp.show.service;

import com.showapp.show.application.resolution.CanonicalDecision;
import com.showapp.show.domain.show.Show;

public record ShowResolution(Show show, CanonicalDecision decision) {
}
