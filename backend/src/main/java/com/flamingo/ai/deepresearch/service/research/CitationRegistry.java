package com.flamingo.ai.deepresearch.service.research;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps canonical source URLs to citation ids. Ids start at 1, are assigned in first-seen order and
 * never change or disappear once handed out.
 */
public class CitationRegistry {

  private final Map<String, Integer> ids = new LinkedHashMap<>();

  public CitationRegistry() {}

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  CitationRegistry(Map<String, Integer> restored) {
    if (restored != null) {
      restored.entrySet().stream()
          .sorted(Map.Entry.comparingByValue())
          .forEach(entry -> ids.put(entry.getKey(), entry.getValue()));
    }
  }

  /** Returns the id of the URL, assigning the next one if the URL is new. */
  public synchronized int assign(String url) {
    return ids.computeIfAbsent(canonicalize(url), key -> ids.size() + 1);
  }

  /** Returns the id of the URL, or {@code null} if it has none. */
  public synchronized Integer idOf(String url) {
    return ids.get(canonicalize(url));
  }

  public synchronized int size() {
    return ids.size();
  }

  @JsonValue
  public synchronized Map<String, Integer> asMap() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(ids));
  }

  /**
   * Lower-cases scheme and host, drops the fragment and a trailing slash. Unparseable URLs are
   * only trimmed.
   */
  static String canonicalize(String url) {
    String trimmed = url == null ? "" : url.strip();
    try {
      URI uri = new URI(trimmed);
      if (uri.getScheme() == null || uri.getHost() == null) {
        return trimmed;
      }
      String path = uri.getRawPath() == null ? "" : uri.getRawPath();
      if (path.endsWith("/")) {
        path = path.substring(0, path.length() - 1);
      }
      StringBuilder canonical =
          new StringBuilder()
              .append(uri.getScheme().toLowerCase(Locale.ROOT))
              .append("://")
              .append(uri.getHost().toLowerCase(Locale.ROOT));
      if (uri.getPort() != -1) {
        canonical.append(':').append(uri.getPort());
      }
      canonical.append(path);
      if (uri.getRawQuery() != null) {
        canonical.append('?').append(uri.getRawQuery());
      }
      return canonical.toString();
    } catch (URISyntaxException e) {
      return trimmed;
    }
  }
}
