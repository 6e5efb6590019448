package com.propertyintel.estate.client;

import com.propertyintel.estate.config.EstateScraperProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.Set;

/**
 * Thin client over the sreality.cz JSON API.
 *
 * Every call waits for the {@link AutoThrottle} first. Statuses on the
 * configured retry list and I/O errors surface as
 * {@link TransientFetchException}, which the "srealityApi" Resilience4j
 * retry instance repeats with exponential backoff. Anything else is a
 * {@link FatalFetchException} and is not retried.
 */
@Service
@Slf4j
public class SrealityApiClient implements FetchClient {

    private final RestTemplate restTemplate;
    private final AutoThrottle throttle;
    private final Set<Integer> retryHttpCodes;
    private final HttpEntity<Void> requestEntity;

    public SrealityApiClient(RestTemplate restTemplate, AutoThrottle throttle, EstateScraperProperties properties) {
        this.restTemplate = restTemplate;
        this.throttle = throttle;
        this.retryHttpCodes = Set.copyOf(properties.getApi().getRetryHttpCodes());

        HttpHeaders headers = new HttpHeaders();
        properties.getApi().getHeaders().forEach(headers::set);
        this.requestEntity = new HttpEntity<>(headers);
    }

    @Override
    @Retry(name = "srealityApi")
    public String fetch(String url) {
        log.debug("Calling Sreality API: {}", url);
        throttle.awaitTurn();
        long started = System.currentTimeMillis();

        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, requestEntity, String.class);
            throttle.onResponse(System.currentTimeMillis() - started, true);
            String body = response.getBody();
            return body == null ? "" : body;

        } catch (RestClientResponseException e) {
            throttle.onResponse(System.currentTimeMillis() - started, false);
            int status = e.getStatusCode().value();
            if (retryHttpCodes.contains(status)) {
                log.warn("HTTP {} from Sreality API, will retry: {}", status, url);
                throw new TransientFetchException("HTTP " + status, url, status, e);
            }
            log.error("HTTP {} from Sreality API, not retrying: {}", status, url);
            throw new FatalFetchException("HTTP " + status, url, status, e);

        } catch (ResourceAccessException e) {
            throttle.onResponse(System.currentTimeMillis() - started, false);
            log.warn("I/O error calling {}: {}", url, e.getMessage());
            throw new TransientFetchException(e.getMessage(), url, 0, e);
        }
    }
}
