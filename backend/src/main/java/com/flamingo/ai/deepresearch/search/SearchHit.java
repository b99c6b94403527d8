package com.flamingo.ai.deepresearch.search;

/** A single result returned by a retrieval provider. */
public record SearchHit(String url, String title, String snippet) {

  /** Formats the hit as a snippet followed by a markdown citation. */
  public String toCitedSnippet() {
    String label = title == null || title.isBlank() ? url : title.strip();
    String text = snippet == null ? "" : snippet.strip();
    return text.isEmpty() ? "[" + label + "](" + url + ")" : text + " [" + label + "](" + url + ")";
  }
}
