package com.flamingo.ai.memorybot.service.media;

/**
 * Body of one successful HTTP fetch.
 *
 * @param body response bytes, never null
 * @param contentType value of the Content-Type header, may be null
 * @param url address the bytes were fetched from
 */
public record FetchedMedia(byte[] body, String contentType, String url) {

  public boolean isEmpty() {
    return body.length == 0;
  }
}
