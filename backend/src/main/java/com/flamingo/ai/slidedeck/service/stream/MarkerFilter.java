package com.flamingo.ai.slidedeck.service.stream;

/**
 * Incremental filter that removes a literal control marker from a text stream.
 *
 * <p>The last {@code marker.length() - 1} characters are withheld because they may be the start of
 * a marker split across fragments. Marker search also covers the tail of what has already been
 * emitted, so the concatenated output never contains the marker, even where removing one
 * occurrence joins the surrounding text into another.
 *
 * <p>Not thread-safe; create one per stream.
 */
public class MarkerFilter {

  private final String marker;
  private final int withheld;
  private final StringBuilder pending = new StringBuilder();
  private final StringBuilder emitted = new StringBuilder();
  private boolean markerSeen;
  private boolean finished;

  public MarkerFilter(String marker) {
    if (marker == null || marker.isEmpty()) {
      throw new IllegalArgumentException("Marker must not be empty");
    }
    this.marker = marker;
    this.withheld = marker.length() - 1;
  }

  /**
   * Feeds the next fragment.
   *
   * @param fragment text as produced by the model, may be empty
   * @return text that is now safe to forward, possibly empty
   */
  public String accept(String fragment) {
    if (finished) {
      throw new IllegalStateException("Filter already finished");
    }
    if (fragment == null || fragment.isEmpty()) {
      return "";
    }
    pending.append(fragment);
    stripMarkers();

    int emitLength = pending.length() - withheld;
    if (emitLength <= 0) {
      return "";
    }
    String safe = pending.substring(0, emitLength);
    pending.delete(0, emitLength);
    emitted.append(safe);
    return safe;
  }

  /**
   * Ends the stream and flushes the withheld text.
   *
   * @return remaining text, possibly empty
   */
  public String finish() {
    if (finished) {
      return "";
    }
    finished = true;
    stripMarkers();
    String rest = pending.toString();
    pending.setLength(0);
    emitted.append(rest);
    return rest;
  }

  /** Whether the marker occurred anywhere in the text seen so far. */
  public boolean isMarkerSeen() {
    return markerSeen;
  }

  /** Everything emitted so far, marker-free. */
  public String filteredText() {
    return emitted.toString();
  }

  private void stripMarkers() {
    while (true) {
      int tailLength = Math.min(withheld, emitted.length());
      String window = emitted.substring(emitted.length() - tailLength) + pending;
      int index = window.indexOf(marker);
      if (index < 0) {
        return;
      }
      markerSeen = true;
      // Emitted text cannot be taken back; drop only the part of the occurrence still pending.
      int start = Math.max(0, index - tailLength);
      int end = index + marker.length() - tailLength;
      pending.delete(start, end);
    }
  }
}
