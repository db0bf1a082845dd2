package org.workerwatch.alert.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class ForcedAlertOptions {
  @Builder.Default private final boolean ignoreCooldown = false;
  @Builder.Default private final double mockErrorRate = 25;
  @Builder.Default private final double mockLlmErrorRate = 35;

  public static ForcedAlertOptions defaults() {
    return ForcedAlertOptions.builder().build();
  }
}
