package com.scholary.captions.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.transcript.Segment;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryWindowCacheTest {

  private final InMemoryWindowCache cache = new InMemoryWindowCache(100, 1);

  @Test
  void get_shouldReturnStoredSegments() {
    String key = WindowCache.generateKey("abc", 1, 30.0, 60.0);
    cache.put(key, List.of(Segment.speech("Hello", 30.0, 32.0)));

    assertThat(cache.get(key)).contains(List.of(Segment.speech("Hello", 30.0, 32.0)));
    assertThat(cache.get(WindowCache.generateKey("abc", 2, 60.0, 65.0))).isEmpty();
  }

  @Test
  void put_shouldCopySegments() {
    String key = WindowCache.generateKey("abc", 0, 0.0, 30.0);
    List<Segment> segments = new ArrayList<>();
    segments.add(Segment.speech("Hello", 0.0, 2.0));
    cache.put(key, segments);
    segments.clear();

    assertThat(cache.get(key).orElseThrow()).hasSize(1);
  }

  @Test
  void generateKey_shouldIncludeFingerprintIndexAndBounds() {
    assertThat(WindowCache.generateKey("abc", 2, 60.0, 65.0))
        .isEqualTo("abc:window-2:60.000-65.000");
  }
}
