package se.alipsa.jdruid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.URI;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class ConnectionDetailsTest {

  @Test
  public void testFromUrlWithDefaults() {
    ConnectionDetails details = ConnectionDetails.fromUrl("druid://broker.example.com");
    assertEquals("broker.example.com", details.host());
    assertEquals(ConnectionDetails.DEFAULT_PORT, details.port());
    assertEquals("http", details.scheme());
    assertEquals(URI.create("http://broker.example.com:8082/druid/v2/"), details.queryEndpoint());
  }

  @Test
  public void testFromUrlWithOptions() {
    ConnectionDetails details = ConnectionDetails.fromUrl("druid://localhost:9088/druid/v2/?ssl=true&timeout=500");
    assertEquals(9088, details.port());
    assertEquals("https", details.scheme());
    assertEquals("500", details.option("timeout", null));
    assertNull(details.option("ssl", null));
    assertEquals(URI.create("https://localhost:9088/druid/v2/"), details.queryEndpoint());
  }

  @Test
  public void testOptionsCannotBeChangedAfterConstruction() {
    Properties source = new Properties();
    source.setProperty("timeout", "500");
    ConnectionDetails details = new ConnectionDetails("localhost", 8082, "http", "/druid/v2/", source);

    source.setProperty("timeout", "1");
    details.options().setProperty("timeout", "999");

    assertEquals("500", details.option("timeout", null));
    assertEquals("500", details.options().getProperty("timeout"));
  }

  @Test
  public void testInvalidUrls() {
    assertThrows(IllegalArgumentException.class, () -> ConnectionDetails.fromUrl("http://localhost:8082"));
    assertThrows(IllegalArgumentException.class, () -> ConnectionDetails.fromUrl("druid://:8082"));
  }

  @Test
  public void testPropertiesStore() {
    Properties props = new Properties();
    props.setProperty("database.3.url", "druid://localhost:8082?timeout=100");
    props.setProperty("database.3.timeout", "200");
    props.setProperty("database.3.user", "admin");
    props.setProperty("database.4.timeout", "1");
    PropertiesDetailsStore store = new PropertiesDetailsStore(props);

    ConnectionDetails details = store.details(3);
    assertEquals("localhost", details.host());
    assertEquals("200", details.option("timeout", null));
    assertEquals("admin", details.option("user", null));
    assertThrows(IllegalArgumentException.class, () -> store.details(4));
    assertThrows(IllegalArgumentException.class, () -> store.details(5));
  }

  @Test
  public void testPropertiesStoreFromResource() throws IOException {
    PropertiesDetailsStore store = PropertiesDetailsStore.fromResource("/jdruid-test.properties");
    assertEquals("broker.example.com", store.details(1).host());
    assertEquals("30000", store.details(1).option("timeout", null));

    ConnectionDetails secure = store.details(2);
    assertEquals("https", secure.scheme());
    assertEquals(ConnectionDetails.DEFAULT_PORT, secure.port());
    assertEquals("analyst", secure.option("user", null));
    assertEquals("60000", secure.option("timeout", null));
    assertThrows(IOException.class, () -> PropertiesDetailsStore.fromResource("/missing.properties"));
  }

  @Test
  public void testMiddlewareSettings() {
    assertEquals(true, MiddlewareSettings.defaults().formatRows());
    assertEquals(MiddlewareSettings.defaults(), MiddlewareSettings.fromProperties(null));
    Properties props = new Properties();
    props.setProperty("format-rows", "false");
    assertEquals(false, MiddlewareSettings.fromProperties(props).formatRows());
    props = new Properties();
    props.setProperty("formatRows", "FALSE");
    assertEquals(false, MiddlewareSettings.fromProperties(props).formatRows());
    assertEquals(true, MiddlewareSettings.fromProperties(new Properties()).formatRows());
  }
}
