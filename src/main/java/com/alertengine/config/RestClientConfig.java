package com.alertengine.config;

import com.alertengine.engine.AlertEngineConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplates for outbound calls. Every outbound call gets a connect and read timeout
 * so a stuck endpoint turns into a failure instead of a hung thread.
 */
@Configuration
public class RestClientConfig {

    @Bean("notificationRestTemplate")
    public RestTemplate notificationRestTemplate(AlertEngineConfig alertEngineConfig) {
        return buildRestTemplate((int) alertEngineConfig.getNotification().getTimeout().toMillis());
    }

    @Bean("healthProbeRestTemplate")
    public RestTemplate healthProbeRestTemplate(AlertEngineConfig alertEngineConfig) {
        return buildRestTemplate((int) alertEngineConfig.getHealthProbe().getTimeout().toMillis());
    }

    private RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return new RestTemplate(requestFactory);
    }
}
