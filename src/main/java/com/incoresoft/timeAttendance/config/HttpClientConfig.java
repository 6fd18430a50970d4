package com.incoresoft.timeAttendance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

@Configuration
@EnableConfigurationProperties({DeviceProps.class, AttendanceProps.class, NotificationProps.class})
public class HttpClientConfig {
    @Bean
    public RestTemplate terminalRestTemplate(DeviceProps props, RestTemplateBuilder builder) {
        ClientHttpRequestInterceptor auth = (req, body, exec) -> {
            if (props.getToken() != null && !props.getToken().isBlank()) {
                req.getHeaders().add("Authorization", "Bearer " + props.getToken());
            }
            req.getHeaders().add("Accept", "application/json");
            return exec.execute(req, body);
        };
        return builder
                .setConnectTimeout(Duration.ofSeconds(props.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(props.getReadTimeoutSeconds()))
                .additionalInterceptors(List.of(auth))
                .build();
    }

    /** Bounded retry around a single terminal fetch. 4xx responses are not retried. */
    @Bean
    public RetryTemplate terminalRetryTemplate(DeviceProps props) {
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, props.getConnectAttempts()))
                .exponentialBackoff(props.getBackoffInitialMs(), props.getBackoffMultiplier(), props.getBackoffMaxMs())
                .retryOn(ResourceAccessException.class)
                .retryOn(HttpServerErrorException.class)
                .build();
    }

    @Bean
    public Clock clock(AttendanceProps props) {
        return Clock.system(ZoneId.of(props.getTimezone()));
    }
}
