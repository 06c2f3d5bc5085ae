package jdruid.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.alipsa.jdruid.engine.ColumnGetters;
import se.alipsa.jdruid.engine.ProjectedColumn;
import se.alipsa.jdruid.engine.ValueGetter;

class ColumnGettersTest {

  @Test
  void gettersFollowProjectionOrder() {
    Map<String, Object> row = Map.of("a", 1, "b", "two", "distinct___count", 9.5);
    List<ValueGetter> getters = ColumnGetters.forColumns(ProjectedColumn.of(List.of("distinct___count", "b", "a")));

    assertEquals(3, getters.size());
    assertEquals(10L, getters.get(0).get(row));
    assertEquals("two", getters.get(1).get(row));
    assertEquals(1, getters.get(2).get(row));
  }

  @Test
  void renamedColumnsKeepTheirDecoding() {
    Map<String, Object> row = Map.of("timestamp___int", "12", "distinct___count", 2.4, "page", "home");
    List<ProjectedColumn> columns = ProjectedColumn.of(List.of("timestamp___int", "page", "distinct___count"));

    List<ValueGetter> getters = ColumnGetters.forColumnNames(List.of("count", "timestamp", "page"), columns);

    assertEquals(2L, getters.get(0).get(row));
    assertEquals(12, getters.get(1).get(row));
    assertEquals("home", getters.get(2).get(row));
  }

  @Test
  void repeatedNamesTakeColumnsInProjectionOrder() {
    Map<String, Object> row = Map.of("timestamp___int", "3", "v", 1, "timestamp", "2020-01-01T00:00:00.000Z");
    List<ProjectedColumn> columns = ProjectedColumn.of(List.of("timestamp___int", "v", "timestamp"));

    List<ValueGetter> getters = ColumnGetters.forColumnNames(List.of("timestamp", "v", "timestamp"), columns);

    assertEquals(3, getters.get(0).get(row));
    assertEquals(1, getters.get(1).get(row));
    assertEquals("2020-01-01T00:00:00.000Z", getters.get(2).get(row));
  }

  @Test
  void unknownNamesAreReadAsIs() {
    List<ValueGetter> getters = ColumnGetters.forColumnNames(List.of("extra"), ProjectedColumn.of(List.of("a")));
    assertEquals("x", getters.get(0).get(Map.of("extra", "x")));
    assertNull(getters.get(0).get(Map.of("a", 1)));
  }

  @Test
  void missingIntegerEncodedValueIsAbsent() {
    Map<String, Object> row = new HashMap<>();
    row.put("timestamp___int", null);
    ValueGetter getter = ColumnGetters.forColumn(ProjectedColumn.of("timestamp___int"));
    assertNull(getter.get(row));
    assertNull(getter.get(Map.of()));
  }

  @Test
  void malformedIntegerEncodedValuePropagates() {
    ValueGetter getter = ColumnGetters.forColumn(ProjectedColumn.of("timestamp___int"));
    assertThrows(NumberFormatException.class, () -> getter.get(Map.of("timestamp___int", "week 3")));
  }
}
