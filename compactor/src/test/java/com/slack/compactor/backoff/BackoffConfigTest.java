package com.slack.compactor.backoff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.slack.compactor.proto.config.CompactorConfigs;
import java.time.Duration;
import org.junit.jupiter.api.Test;

public class BackoffConfigTest {

  @Test
  public void testDefaults() {
    BackoffConfig backoffConfig = BackoffConfig.defaultConfig();

    assertThat(backoffConfig.getInitBackoff()).isEqualTo(Duration.ofMillis(100));
    assertThat(backoffConfig.getMaxBackoff()).isEqualTo(Duration.ofSeconds(500));
    assertThat(backoffConfig.getBase()).isEqualTo(3.0);
    assertThat(backoffConfig.getDeadline()).isEmpty();
    assertThat(backoffConfig.getMaxAttempts()).isEmpty();
  }

  @Test
  public void testUnsetProtoFieldsUseDefaults() {
    BackoffConfig backoffConfig =
        BackoffConfig.fromConfig(CompactorConfigs.BackoffConfig.getDefaultInstance());

    assertThat(backoffConfig).isEqualTo(BackoffConfig.defaultConfig());
  }

  @Test
  public void testFromProto() {
    BackoffConfig backoffConfig =
        BackoffConfig.fromConfig(
            CompactorConfigs.BackoffConfig.newBuilder()
                .setInitBackoffMs(20)
                .setMaxBackoffMs(2000)
                .setBase(2.5)
                .setDeadlineMs(60000)
                .setMaxAttempts(12)
                .build());

    assertThat(backoffConfig.getInitBackoff()).isEqualTo(Duration.ofMillis(20));
    assertThat(backoffConfig.getMaxBackoff()).isEqualTo(Duration.ofMillis(2000));
    assertThat(backoffConfig.getBase()).isEqualTo(2.5);
    assertThat(backoffConfig.getDeadline()).contains(Duration.ofMinutes(1));
    assertThat(backoffConfig.getMaxAttempts()).hasValue(12);
  }

  @Test
  public void testInvalidValues() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> BackoffConfig.builder().initBackoff(Duration.ZERO).build());
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                BackoffConfig.builder()
                    .initBackoff(Duration.ofSeconds(2))
                    .maxBackoff(Duration.ofSeconds(1))
                    .build());
    assertThatIllegalArgumentException()
        .isThrownBy(() -> BackoffConfig.builder().base(0.5).build());
    assertThatIllegalArgumentException()
        .isThrownBy(() -> BackoffConfig.builder().deadline(Duration.ofMillis(-1)).build());
    assertThatIllegalArgumentException()
        .isThrownBy(() -> BackoffConfig.builder().maxAttempts(0).build());
  }
}
