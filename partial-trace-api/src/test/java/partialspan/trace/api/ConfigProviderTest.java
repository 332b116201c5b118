package partialspan.trace.api;

import static java.util.Collections.emptyMap;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConfigProviderTest {
  private static final String KEY = "test.only.key";

  @AfterEach
  void clearSystemProperty() {
    System.clearProperty(ConfigProvider.PROPERTY_PREFIX + KEY);
  }

  @Test
  void environmentVariableNames() {
    assertEquals(
        "PARTIALSPAN_HEARTBEAT_INITIAL_DELAY_MS",
        ConfigProvider.toEnvVar("heartbeat.initial-delay.ms"));
    assertEquals("PARTIALSPAN_SINK_TYPE", ConfigProvider.toEnvVar("sink.type"));
  }

  @Test
  void readsPrefixedSystemProperties() {
    System.setProperty(ConfigProvider.PROPERTY_PREFIX + KEY, " value ");

    assertEquals("value", ConfigProvider.createDefault().getString(KEY));
  }

  @Test
  void propertiesOverrideIgnoresSystemProperties() {
    System.setProperty(ConfigProvider.PROPERTY_PREFIX + KEY, "from-system");

    ConfigProvider provider = ConfigProvider.withPropertiesOverride(new Properties());

    assertNull(provider.getString(KEY));
    assertEquals("fallback", provider.getString(KEY, "fallback"));
  }

  @Test
  void blankValuesAreMissing() {
    ConfigProvider provider = provider(KEY, "   ");

    assertNull(provider.getString(KEY));
    assertEquals(12, provider.getLong(KEY, 12));
  }

  @Test
  void parsesLongs() {
    assertEquals(250, provider(KEY, "250").getLong(KEY, 1));
    assertEquals(-3, provider(KEY, "-3").getLong(KEY, 1));
  }

  @Test
  void invalidLongFallsBackToDefault() {
    assertEquals(5000, provider(KEY, "five seconds").getLong(KEY, 5000));
  }

  @Test
  void parsesMapsSkippingMalformedEntries() {
    Map<String, String> expected = new LinkedHashMap<>();
    expected.put("service.name", "checkout");
    expected.put("env", "prod:eu");
    expected.put("empty", "");

    assertEquals(
        expected,
        provider(KEY, "service.name:checkout, novalue ,:orphan,env:prod:eu,empty:").getMap(KEY));
  }

  @Test
  void missingMapIsEmpty() {
    assertEquals(emptyMap(), provider("other", "a:b").getMap(KEY));
  }

  private static ConfigProvider provider(String key, String value) {
    Properties properties = new Properties();
    properties.setProperty(key, value);
    return ConfigProvider.withPropertiesOverride(properties);
  }
}
