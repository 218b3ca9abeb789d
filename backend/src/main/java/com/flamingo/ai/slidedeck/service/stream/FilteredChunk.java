package com.flamingo.ai.slidedeck.service.stream;

/**
 * Output of {@link MarkerFilteringProcessor}: either a data fragment or the single terminal event.
 *
 * @param fragment marker-free text to forward, possibly empty on the terminal event
 * @param terminal whether this is the terminal event
 * @param fullText on the terminal event, the whole filtered text; otherwise {@code null}
 * @param markerSeen on the terminal event, whether the marker occurred anywhere in the stream
 */
public record FilteredChunk(
    String fragment, boolean terminal, String fullText, boolean markerSeen) {

  public static FilteredChunk data(String fragment) {
    return new FilteredChunk(fragment, false, null, false);
  }

  public static FilteredChunk terminal(String remainder, String fullText, boolean markerSeen) {
    return new FilteredChunk(remainder, true, fullText, markerSeen);
  }
}
