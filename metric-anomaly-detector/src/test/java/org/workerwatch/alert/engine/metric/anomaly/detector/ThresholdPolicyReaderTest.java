package org.workerwatch.alert.engine.metric.anomaly.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.ThresholdPolicy;

class ThresholdPolicyReaderTest {

  @Test
  void testDefaults() {
    ThresholdPolicy policy = ThresholdPolicyReader.defaults();
    assertEquals(5, policy.getErrorRatePercent());
    assertEquals(2000, policy.getP95LatencyMs());
    assertEquals(3000, policy.getP99LatencyMs());
    assertEquals(2.0, policy.getTrafficSpikeMultiplier());
    assertEquals(10, policy.getLlmErrorRatePercent());
    assertEquals(20000, policy.getLlmP95LatencyMs());
    assertEquals(3.0, policy.getLlmTokenSpikeMultiplier());
  }

  @Test
  void testOverridesLayeredOverDefaults() {
    Config appConfig =
        ConfigFactory.parseMap(
            Map.of("thresholds.errorRatePercent", 2.5, "thresholds.p99LatencyMs", 4000));
    ThresholdPolicy policy = ThresholdPolicyReader.fromConfig(appConfig);

    assertEquals(2.5, policy.getErrorRatePercent());
    assertEquals(4000, policy.getP99LatencyMs());
    assertEquals(2000, policy.getP95LatencyMs());
  }

  @Test
  void testMissingKeyWithoutDefaultsFails() {
    Config thresholds = ConfigFactory.parseMap(Map.of("errorRatePercent", 5));
    assertThrows(ConfigException.Missing.class, () -> ThresholdPolicyReader.read(thresholds));
  }
}
