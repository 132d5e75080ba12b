package com.codeheadsystems.keyrelay.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyrelay.model.DeliveryChannel;
import com.codeheadsystems.keyrelay.model.ErrorCode;
import com.codeheadsystems.keyrelay.model.Platform;
import com.codeheadsystems.keyrelay.server.exception.KeyRelayException;
import com.codeheadsystems.keyrelay.server.model.DeviceTokenRecord;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryTokenDirectoryTest {

  private InMemoryTokenDirectory directory;

  @BeforeEach
  void setUp() {
    directory = new InMemoryTokenDirectory();
  }

  @Test
  void tokensFor_unknownSession_isEmpty() {
    assertThat(directory.tokensFor("S-nobody")).isEmpty();
  }

  @Test
  void register_twice_keepsOneRecordAndLink() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.link("tok", "S1");

    DeviceTokenRecord updated = directory.register("tok", Platform.ANDROID, DeliveryChannel.SILENT);

    assertThat(updated.sessionId()).isEqualTo("S1");
    assertThat(updated.platform()).isEqualTo(Platform.ANDROID);
    assertThat(directory.tokensFor("S1")).containsExactly(updated);
  }

  @Test
  void register_doesNotLink() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);

    assertThat(directory.find("tok")).get().extracting(DeviceTokenRecord::isLinked).isEqualTo(false);
  }

  @Test
  void link_unregistered_throwsUnknownToken() {
    assertThatThrownBy(() -> directory.link("ghost", "S1"))
        .isInstanceOf(KeyRelayException.class)
        .extracting(e -> ((KeyRelayException) e).code())
        .isEqualTo(ErrorCode.UNKNOWN_TOKEN);
  }

  @Test
  void link_twiceToSameSession_isNoOp() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);
    DeviceTokenRecord first = directory.link("tok", "S1");
    DeviceTokenRecord second = directory.link("tok", "S1");

    assertThat(second).isEqualTo(first);
    assertThat(directory.tokensFor("S1")).hasSize(1);
  }

  @Test
  void link_toNewSession_movesToken() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.link("tok", "S1");

    directory.link("tok", "S2");

    assertThat(directory.tokensFor("S1")).isEmpty();
    assertThat(directory.tokensFor("S2")).extracting(DeviceTokenRecord::token).containsExactly("tok");
  }

  @Test
  void link_leavesOtherTokensOfSessionAlone() {
    directory.register("phone", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.register("tablet", Platform.ANDROID, DeliveryChannel.DEFAULT);
    directory.link("phone", "S1");
    directory.link("tablet", "S1");

    assertThat(directory.tokensFor("S1")).extracting(DeviceTokenRecord::token)
        .containsExactlyInAnyOrder("phone", "tablet");
  }

  @Test
  void unlink_clearsLinkButKeepsRegistration() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.link("tok", "S1");

    directory.unlink("tok");

    assertThat(directory.tokensFor("S1")).isEmpty();
    assertThat(directory.find("tok")).isPresent();
  }

  @Test
  void remove_deletesRecordAndLink() {
    directory.register("tok", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.link("tok", "S1");

    assertThat(directory.remove("tok")).isTrue();
    assertThat(directory.remove("tok")).isFalse();
    assertThat(directory.find("tok")).isEmpty();
    assertThat(directory.tokensFor("S1")).isEmpty();
  }

  @Test
  void concurrentLinkAndUnlinkOnSameSession_neverLosesALink() throws Exception {
    directory.register("phone", Platform.IOS, DeliveryChannel.DEFAULT);
    directory.register("tablet", Platform.ANDROID, DeliveryChannel.DEFAULT);
    int rounds = 50_000;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> churn = pool.submit(() -> {
        start.await();
        for (int i = 0; i < rounds; i++) {
          directory.link("phone", "S1");
          directory.unlink("phone");
        }
        return null;
      });
      Future<Integer> lost = pool.submit(() -> {
        start.await();
        int missing = 0;
        for (int i = 0; i < rounds; i++) {
          directory.link("tablet", "S1");
          boolean indexed = directory.tokensFor("S1").stream()
              .anyMatch(record -> record.token().equals("tablet"));
          if (!indexed) {
            missing++;
          }
          directory.unlink("tablet");
        }
        return missing;
      });
      start.countDown();

      churn.get();
      assertThat(lost.get()).isZero();
    } finally {
      pool.shutdownNow();
    }
  }
}
