package com.ospicorp.sgs.series.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.sgs.series.exception.SeriesNotFoundException;
import com.ospicorp.sgs.series.exception.UpstreamException;
import com.ospicorp.sgs.series.exception.UpstreamTimeoutException;
import com.ospicorp.sgs.series.model.DateRange;
import com.ospicorp.sgs.series.model.RawPoint;
import com.ospicorp.sgs.series.model.SeriesMetadata;
import com.ospicorp.sgs.series.service.DateNormalizer;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues exactly one logical upstream request per call, retrying throttling, server errors
 * and I/O timeouts according to the {@link RetryPolicy}.
 */
@Component
public class SgsClient {
  private static final Logger log = LoggerFactory.getLogger(SgsClient.class);
  public static final String DEFAULT_BASE_URL =
      "https://api.bcb.gov.br/dados/serie/bcdata.sgs.{seriesId}";

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public SgsClient(RestTemplate restTemplate,
      @Value("${sgs.base-url:" + DEFAULT_BASE_URL + "}") String baseUrl,
      RetryPolicy retryPolicy,
      Sleeper sleeper) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  public List<RawPoint> fetchRange(long seriesId, DateRange range) {
    URI uri = UriComponentsBuilder.fromUriString(baseUrl)
        .path("/dados")
        .queryParam("formato", "json")
        .queryParam("dataInicial", DateNormalizer.toUpstream(range.start()))
        .queryParam("dataFinal", DateNormalizer.toUpstream(range.end()))
        .buildAndExpand(Map.of("seriesId", seriesId))
        .encode()
        .toUri();
    return execute(seriesId, uri);
  }

  public List<RawPoint> fetchLast(long seriesId, int n) {
    URI uri = UriComponentsBuilder.fromUriString(baseUrl)
        .path("/dados/ultimos/{n}")
        .queryParam("formato", "json")
        .buildAndExpand(Map.of("seriesId", seriesId, "n", n))
        .encode()
        .toUri();
    return execute(seriesId, uri);
  }

  /**
   * Confirms the series exists with a single "last 1" probe (no retries), then reads the
   * descriptive endpoint. Fields the upstream does not provide come back {@code null}.
   */
  public SeriesMetadata fetchMetadata(long seriesId) {
    URI probe = UriComponentsBuilder.fromUriString(baseUrl)
        .path("/dados/ultimos/1")
        .queryParam("formato", "json")
        .buildAndExpand(Map.of("seriesId", seriesId))
        .encode()
        .toUri();
    try {
      restTemplate.getForEntity(probe, JsonNode.class);
    } catch (HttpClientErrorException.NotFound e) {
      throw SeriesNotFoundException.forId(seriesId);
    } catch (HttpStatusCodeException e) {
      throw new UpstreamException(e.getStatusCode().value(), e.getResponseBodyAsString(), e);
    } catch (ResourceAccessException e) {
      throw new UpstreamTimeoutException(seriesId, 1, e);
    }

    URI uri = UriComponentsBuilder.fromUriString(baseUrl)
        .queryParam("formato", "json")
        .buildAndExpand(Map.of("seriesId", seriesId))
        .encode()
        .toUri();
    try {
      JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
      if (body != null && body.isObject()) {
        String name = body.path("nomeCompleto").asText(null);
        return new SeriesMetadata(seriesId,
            name != null ? name : body.path("nome").asText(null),
            nameOf(body.path("unidadePadrao")),
            nameOf(body.path("periodicidade")),
            nameOf(body.path("gestorProprietario")),
            body.path("dataInicio").asText(null),
            body.path("dataFim").asText(null));
      }
    } catch (RestClientException e) {
      log.debug("Metadata endpoint unavailable for series {}: {}", seriesId, e.getMessage());
    }
    return new SeriesMetadata(seriesId, null, null, null, null, null, null);
  }

  private List<RawPoint> execute(long seriesId, URI uri) {
    RetryState state = RetryState.initial();
    while (true) {
      state = state.nextAttempt();
      try {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity(uri, JsonNode.class);
        return toRawPoints(response);
      } catch (RestClientException ex) {
        ErrorKind kind = ErrorKind.classify(ex);
        state = state.failedWith(kind);
        if (!kind.isRetryable()) {
          throw terminal(seriesId, kind, ex);
        }
        if (!retryPolicy.canRetry(state)) {
          log.warn("Giving up on series {} after {} attempts, last error {}",
              seriesId, state.attemptNumber(), kind);
          throw new UpstreamTimeoutException(seriesId, state.attemptNumber(), ex);
        }
        Duration delay = retryPolicy.delayAfter(state.attemptNumber());
        log.warn("{} on series {} (attempt {}/{}), retrying in {} ms",
            kind, seriesId, state.attemptNumber(), retryPolicy.maxAttempts(), delay.toMillis());
        pause(seriesId, state, delay);
      }
    }
  }

  private RuntimeException terminal(long seriesId, ErrorKind kind, RestClientException ex) {
    if (kind == ErrorKind.NOT_FOUND) {
      return SeriesNotFoundException.forId(seriesId);
    }
    if (ex instanceof HttpStatusCodeException status) {
      return new UpstreamException(status.getStatusCode().value(),
          status.getResponseBodyAsString(), ex);
    }
    return new UpstreamException(200, "unreadable payload for series " + seriesId, ex);
  }

  private List<RawPoint> toRawPoints(ResponseEntity<JsonNode> response) {
    JsonNode body = response.getBody();
    if (body == null || body.isNull() || body.isMissingNode()) {
      return List.of();
    }
    if (!body.isArray()) {
      throw new UpstreamException(response.getStatusCode().value(),
          "expected a JSON array but got " + body.getNodeType());
    }
    List<RawPoint> points = new ArrayList<>(body.size());
    for (JsonNode element : body) {
      points.add(new RawPoint(element.path("data").asText(null),
          element.path("valor").asText(null)));
    }
    return points;
  }

  private void pause(long seriesId, RetryState state, Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamTimeoutException(seriesId, state.attemptNumber(), e);
    }
  }

  private static String nameOf(JsonNode node) {
    if (node.isObject()) {
      return node.path("nome").asText(null);
    }
    return node.asText(null);
  }
}
