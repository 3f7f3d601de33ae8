package com.example.armoriqadmin.config;

import com.example.armoriqadmin.http.RequestIdFilter;
import java.net.http.HttpClient;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Builds the RestTemplate used to reach the upstream proxy: JDK HttpClient transport with fixed
 * per-request timeouts, no status-based exceptions, request id propagation and debug logging.
 */
@Configuration
@Slf4j
public class ProxyClientConfig {

    @Bean
    public RestTemplate proxyRestTemplate(RestTemplateBuilder builder, ProxyProperties properties) {
        log.info("Forwarding admin requests to ArmorIQ proxy at {} (timeout {})",
                properties.normalizedUrl(), properties.getTimeout());
        return builder
                .requestFactory(() -> requestFactory(properties))
                .errorHandler(new PassThroughErrorHandler())
                .additionalInterceptors(requestIdInterceptor(), loggingInterceptor())
                .build();
    }

    /**
     * JDK HttpClient transport. Request bodies are sent whole, so a 401 on POST or PUT comes back
     * as a response instead of failing the exchange.
     */
    private ClientHttpRequestFactory requestFactory(ProxyProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());
        return requestFactory;
    }

    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            String requestId = MDC.get(RequestIdFilter.MDC_KEY);
            if (requestId != null && !request.getHeaders().containsKey(RequestIdFilter.HEADER)) {
                request.getHeaders().set(RequestIdFilter.HEADER, requestId);
            }
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            log.debug("Proxy request: {} {}", request.getMethod(), request.getURI());

            ClientHttpResponse response = execution.execute(request, body);

            log.debug("Proxy response: {} {} - Status: {} - Duration: {}ms",
                    request.getMethod(),
                    request.getURI(),
                    response.getStatusCode().value(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
