package com.flamingo.ai.memorybot.service.media;

import com.flamingo.ai.memorybot.config.MemoryBotConfig;
import com.flamingo.ai.memorybot.exception.MediaFetchException;
import java.net.URI;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * {@link MediaFetcher} on top of WebClient. Media hosted by the messaging provider is downloaded
 * with the account credentials; everything else is fetched anonymously.
 */
@Component
@Slf4j
public class WebClientMediaFetcher implements MediaFetcher {

  private final WebClient webClient;
  private final MemoryBotConfig.Media media;
  private final MemoryBotConfig.Messaging messaging;

  @Autowired
  public WebClientMediaFetcher(MemoryBotConfig config) {
    this(
        config,
        WebClient.builder()
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create()
                        .followRedirect(true)
                        .responseTimeout(
                            Duration.ofMillis(config.getMedia().getFetchTimeoutMs()))))
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(
                            (int)
                                Math.min(
                                    Integer.MAX_VALUE,
                                    config.getMedia().getMaxFileSizeBytes())))
            .build());
  }

  WebClientMediaFetcher(MemoryBotConfig config, WebClient webClient) {
    this.media = config.getMedia();
    this.messaging = config.getMessaging();
    this.webClient = webClient;
    log.info(
        "Media fetcher initialized: timeout={}ms, maxBytes={}, authHost={}",
        media.getFetchTimeoutMs(),
        media.getMaxFileSizeBytes(),
        media.getAuthHost());
  }

  @Override
  public FetchedMedia fetch(String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new MediaFetchException(url, "Invalid media URL: " + url, e);
    }

    try {
      FetchedMedia fetched =
          webClient
              .get()
              .uri(uri)
              .headers(headers -> addCredentials(headers, uri))
              .<FetchedMedia>exchangeToMono(
                  response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                      return response
                          .releaseBody()
                          .then(
                              Mono.<FetchedMedia>error(
                                  new MediaFetchException(
                                      url, "Media fetch returned HTTP " + response.statusCode())));
                    }
                    String contentType =
                        response.headers().contentType().map(MediaType::toString).orElse(null);
                    return response
                        .bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .map(body -> new FetchedMedia(body, contentType, url));
                  })
              .timeout(Duration.ofMillis(media.getFetchTimeoutMs()))
              .block();
      if (fetched == null) {
        throw new MediaFetchException(url, "Media fetch returned no response");
      }
      log.debug("Fetched {} bytes ({}) from {}", fetched.body().length, fetched.contentType(), url);
      return fetched;
    } catch (MediaFetchException e) {
      throw e;
    } catch (DataBufferLimitException e) {
      throw new MediaFetchException(
          url, "Media exceeds " + media.getMaxFileSizeBytes() + " bytes", e);
    } catch (RuntimeException e) {
      throw new MediaFetchException(url, "Media fetch failed: " + e.getMessage(), e);
    }
  }

  private void addCredentials(HttpHeaders headers, URI uri) {
    if (messaging.hasCredentials()
        && uri.getHost() != null
        && uri.getHost().equalsIgnoreCase(media.getAuthHost())) {
      headers.setBasicAuth(messaging.getAccountSid(), messaging.getAuthToken());
    }
  }
}
