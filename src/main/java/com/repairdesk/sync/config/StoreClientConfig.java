package com.repairdesk.sync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

@Slf4j
@Configuration
public class StoreClientConfig {

    /**
     * RestTemplate for the store's row API. The JDK client is used because the row API
     * is driven with PATCH, which the default URLConnection factory cannot send.
     */
    @Bean
    @Qualifier("storeRestTemplate")
    public RestTemplate storeRestTemplate(RestTemplateBuilder builder,
                                          @Value("${app.store.base-url}") String baseUrl,
                                          @Value("${app.store.api-key:}") String apiKey,
                                          @Value("${app.store.service-token:}") String serviceToken,
                                          @Value("${app.store.timeout:10s}") Duration timeout) {
        log.info("Initializing storeRestTemplate for {}", baseUrl);
        if (apiKey.isBlank()) {
            log.warn("No store API key configured (app.store.api-key). Requests will be anonymous.");
        }
        String bearer = serviceToken.isBlank() ? apiKey : serviceToken;
        return builder
                .rootUri(baseUrl)
                .requestFactory(() -> {
                    JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory();
                    factory.setReadTimeout(timeout);
                    return factory;
                })
                .additionalInterceptors((request, body, execution) -> {
                    if (!apiKey.isBlank()) {
                        request.getHeaders().set("apikey", apiKey);
                        request.getHeaders().setBearerAuth(bearer);
                    }
                    request.getHeaders().setAccept(List.of(MediaType.APPLICATION_JSON));
                    log.debug("STORE_API: {} {}", request.getMethod(), request.getURI());
                    var response = execution.execute(request, body);
                    log.debug("STORE_API: response status {}", response.getStatusCode());
                    return response;
                })
                .build();
    }
}
