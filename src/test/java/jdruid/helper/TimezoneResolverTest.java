package jdruid.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import se.alipsa.jdruid.TimezoneProvider;
import se.alipsa.jdruid.helper.TimezoneResolver;

class TimezoneResolverTest {

  @Test
  void utcNeedsNoConversion() {
    assertTrue(TimezoneResolver.resolve(ZoneId.of("UTC")).isEmpty());
    assertTrue(TimezoneResolver.resolve(ZoneId.of("Etc/UTC")).isEmpty());
    assertTrue(TimezoneResolver.resolve(ZoneOffset.UTC).isEmpty());
    assertTrue(TimezoneResolver.resolve(TimezoneProvider.of(ZoneId.of("Z"))).isEmpty());
  }

  @Test
  void otherZonesAreReturned() {
    ZoneId stockholm = ZoneId.of("Europe/Stockholm");
    assertEquals(Optional.of(stockholm), TimezoneResolver.resolve(TimezoneProvider.of(stockholm)));
    assertEquals(Optional.of(ZoneOffset.ofHours(2)), TimezoneResolver.resolve(ZoneOffset.ofHours(2)));
  }
}
