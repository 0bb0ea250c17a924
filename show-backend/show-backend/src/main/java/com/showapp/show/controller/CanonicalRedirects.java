package com.showapp.show.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the redirect to a show's canonical URL by re-expanding the route the
 * request matched with a new date. Every other path variable and the query
 * string are carried over unchanged.
 */
@Component
public class CanonicalRedirects {

    static final String DATE_VARIABLE = "date";

    public ResponseEntity<Void> toCanonicalDate(HttpServletRequest request, String canonicalDate) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, canonicalLocation(request, canonicalDate))
                .build();
    }

    String canonicalLocation(HttpServletRequest request, String canonicalDate) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern == null) {
            throw new IllegalStateException("No matched route for " + request.getRequestURI());
        }

        Map<String, Object> variables = uriTemplateVariables(request);
        variables.put(DATE_VARIABLE, canonicalDate);

        String path = UriComponentsBuilder.fromPath(pattern.toString())
                .buildAndExpand(variables)
                .encode()
                .toUriString();

        // Query string is already encoded as received.
        String query = request.getQueryString();
        return request.getContextPath() + path + ((query == null || query.isEmpty()) ? "" : "?" + query);
    }

    private Map<String, Object> uriTemplateVariables(HttpServletRequest request) {
        Map<String, Object> variables = new HashMap<>();
        if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE) instanceof Map<?, ?> map) {
            map.forEach((name, value) -> variables.put(String.valueOf(name), value));
        }
        return variables;
    }
}
