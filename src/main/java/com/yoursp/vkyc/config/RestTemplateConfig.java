package com.yoursp.vkyc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate ocrRestTemplate(ExternalServiceProperties properties) {
        return build((int) properties.getOcr().getTimeout().toMillis());
    }

    @Bean
    public RestTemplate registryRestTemplate(ExternalServiceProperties properties) {
        return build((int) properties.getRegistry().getTimeout().toMillis());
    }

    private RestTemplate build(int readTimeoutMillis) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(5_000); // 5 seconds
        factory.setReadTimeout(readTimeoutMillis);
        return new RestTemplate(factory);
    }
}
