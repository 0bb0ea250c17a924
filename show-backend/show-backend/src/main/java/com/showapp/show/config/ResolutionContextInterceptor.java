package com.showapp.show.config;

import com.showapp.show.application.resolution.ResolutionContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;

/**
 * Opens a {@link ResolutionContext} when a request starts and discards it when
 * the request completes, so nothing resolved for one request is seen by another.
 */
@Component
public class ResolutionContextInterceptor implements HandlerInterceptor {

    private final Clock clock;

    public ResolutionContextInterceptor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(ResolutionContext.ATTRIBUTE, ResolutionContext.startingAt(clock.instant()));
        return true;
    }

    @Override
    public void afterCompletion(
            HttpServletRequest request,
            HttpServletResponse response,
            Object handler,
            @Nullable Exception ex) {
        if (request.getAttribute(ResolutionContext.ATTRIBUTE) instanceof ResolutionContext context) {
            context.cache().clear();
        }
        request.removeAttribute(ResolutionContext.ATTRIBUTE);
    }
}
