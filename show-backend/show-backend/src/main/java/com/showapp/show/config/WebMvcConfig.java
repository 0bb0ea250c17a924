package com.showapp.show.config;

import com.showapp.common.web.RequestTraceInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final RequestTraceInterceptor requestTraceInterceptor;
    private final ResolutionContextInterceptor resolutionContextInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestTraceInterceptor);
        registry.addInterceptor(resolutionContextInterceptor).addPathPatterns("/api/**");
    }
}
