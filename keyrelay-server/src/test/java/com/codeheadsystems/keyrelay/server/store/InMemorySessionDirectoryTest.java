package com.codeheadsystems.keyrelay.server.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.keyrelay.server.MutableClock;
import com.codeheadsystems.keyrelay.server.model.ConnectionHandle;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemorySessionDirectoryTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private InMemorySessionDirectory directory;

  @BeforeEach
  void setUp() {
    directory = new InMemorySessionDirectory(new MutableClock(T0));
  }

  @Test
  void markOnline_thenOffline() {
    ConnectionHandle handle = ConnectionHandle.random();

    assertThat(directory.markOnline("S1", handle)).isEmpty();
    assertThat(directory.isOnline("S1")).isTrue();
    assertThat(directory.handleFor("S1")).contains(handle);
    assertThat(directory.presence("S1")).get()
        .satisfies(p -> assertThat(p.lastSeenAt()).isEqualTo(T0));

    directory.markOffline("S1");
    directory.markOffline("S1");
    assertThat(directory.isOnline("S1")).isFalse();
  }

  @Test
  void markOnline_supersedesPreviousHandle() {
    ConnectionHandle first = ConnectionHandle.random();
    ConnectionHandle second = ConnectionHandle.random();
    directory.markOnline("S1", first);

    assertThat(directory.markOnline("S1", second)).contains(first);
    assertThat(directory.handleFor("S1")).contains(second);
  }

  @Test
  void conditionalMarkOffline_ignoresStaleHandle() {
    ConnectionHandle first = ConnectionHandle.random();
    ConnectionHandle second = ConnectionHandle.random();
    directory.markOnline("S1", first);
    directory.markOnline("S1", second);

    assertThat(directory.markOffline("S1", first)).isFalse();
    assertThat(directory.isOnline("S1")).isTrue();
    assertThat(directory.markOffline("S1", second)).isTrue();
    assertThat(directory.isOnline("S1")).isFalse();
  }

  @Test
  void listeners_firedAfterOnline_andFailuresContained() {
    List<String> seen = new ArrayList<>();
    directory.addListener(sessionId -> {
      throw new IllegalStateException("boom");
    });
    directory.addListener(sessionId -> seen.add(sessionId + ":" + directory.isOnline(sessionId)));

    directory.markOnline("S1", ConnectionHandle.random());

    assertThat(seen).containsExactly("S1:true");
  }
}
