package com.agentbox.backend.webClient;

import com.agentbox.backend.exception.ProviderApiException;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Shared blocking call path for the provider strategies. Subclasses supply the service
 * name, base URL and auth headers.
 */
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public abstract class AbstractApiStrategy implements ApiStrategy {

    WebClient webClient;
    String serviceName;
    Duration timeout;

    protected AbstractApiStrategy(WebClient.Builder builder, String serviceName, String baseUrl, Duration timeout) {
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder = builder.baseUrl(baseUrl);
        }
        this.webClient = builder.build();
        this.serviceName = serviceName;
        this.timeout = timeout;
    }

    protected abstract void applyHeaders(HttpHeaders headers);

    @Override
    public boolean isApplicable(String serviceType) {
        return serviceName.equalsIgnoreCase(serviceType);
    }

    @Override
    public String callApi(HttpMethod method, String endpoint, Object requestBody, Map<String, ?> uriVariables) {
        if (!isConfigured()) {
            throw new ProviderApiException(serviceName, "provider not configured", null);
        }
        try {
            WebClient.RequestBodySpec requestSpec = webClient
                    .method(method)
                    .uri(endpoint, uriVariables)
                    .headers(h -> {
                        h.setContentType(MediaType.APPLICATION_JSON);
                        h.setAccept(List.of(MediaType.APPLICATION_JSON));
                        applyHeaders(h);
                    });

            WebClient.RequestHeadersSpec<?> request = requestBody == null
                    ? requestSpec
                    : requestSpec.bodyValue(requestBody);

            Mono<String> mono = request.retrieve()
                    .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(err -> {
                                log.warn("{} API [{} {}] returned {}: {}", serviceName, method, endpoint,
                                        res.statusCode().value(), err);
                                return Mono.error(new ProviderApiException(serviceName, res.statusCode().value(), err));
                            }))
                    .bodyToMono(String.class)
                    .defaultIfEmpty("");

            String result = mono.block(timeout);
            log.debug("{} API [{} {}] success", serviceName, method, endpoint);
            return result;

        } catch (ProviderApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("{} call failed [{} {}]: {}", serviceName, method, endpoint, e.getMessage());
            throw new ProviderApiException(serviceName, e.getMessage(), e);
        }
    }
}
