package com.flamingo.ai.memorybot.service.media;

/** Downloads remote attachment bytes. */
public interface MediaFetcher {

  /**
   * Fetches one URL. Transport-level redirects are followed; indirection documents are returned
   * as-is for the caller to interpret.
   *
   * @throws com.flamingo.ai.memorybot.exception.MediaFetchException on any network failure,
   *     non-2xx status, timeout, or a body above the configured size limit
   */
  FetchedMedia fetch(String url);
}
