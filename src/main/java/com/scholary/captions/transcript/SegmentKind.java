package com.scholary.captions.transcript;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** The kind of audio a caption segment describes. */
public enum SegmentKind {
  SPEECH("speech"),
  MUSIC("music"),
  SOUND("sound"),
  SILENCE("silence");

  private final String wireName;

  SegmentKind(String wireName) {
    this.wireName = wireName;
  }

  /** The lowercase name used in inference replies and transcript JSON. */
  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Look up a kind by its wire name, ignoring case and surrounding whitespace.
   *
   * @return the kind, or empty for null or unknown names
   */
  public static Optional<SegmentKind> fromWire(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (SegmentKind kind : values()) {
      if (kind.wireName.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
