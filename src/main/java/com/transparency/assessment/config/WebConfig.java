package com.transparency.assessment.config;

import com.transparency.assessment.api.CallerAuthInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final CallerAuthInterceptor callerAuthInterceptor;

    public WebConfig(CallerAuthInterceptor callerAuthInterceptor) {
        this.callerAuthInterceptor = callerAuthInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(callerAuthInterceptor).addPathPatterns("/api/**");
    }
}
