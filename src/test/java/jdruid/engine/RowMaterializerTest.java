package jdruid.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import se.alipsa.jdruid.engine.ColumnGetters;
import se.alipsa.jdruid.engine.InMemoryRowReader;
import se.alipsa.jdruid.engine.ProjectedColumn;
import se.alipsa.jdruid.engine.ResultMetadataBuilder;
import se.alipsa.jdruid.engine.RowMaterializer;
import se.alipsa.jdruid.engine.RowReader;
import se.alipsa.jdruid.engine.ValueGetter;
import se.alipsa.jdruid.model.ResultMetadata;

class RowMaterializerTest {

  @Test
  void materializesOneFixedLengthRowPerInputRow() {
    Map<String, Object> partial = new HashMap<>();
    partial.put("country", "NO");
    RowReader reader = new InMemoryRowReader(List.of(
        Map.of("country", "SE", "distinct___count", 10.6, "___sort", 1),
        partial,
        Map.of("country", "DK", "distinct___count", 0.2, "___sort", 3)));
    List<ProjectedColumn> columns = ProjectedColumn.withoutTransient(
        ProjectedColumn.of(List.of("country", "___sort", "distinct___count")));
    List<ValueGetter> getters = ColumnGetters.forColumns(columns);

    List<List<Object>> rows = RowMaterializer.materialize(reader, getters).collect(Collectors.toList());

    assertEquals(3, rows.size());
    assertEquals(List.of("SE", 11L), rows.get(0));
    assertEquals(Arrays.asList("NO", null), rows.get(1));
    assertEquals(List.of("DK", 0L), rows.get(2));
    for (List<Object> row : rows) {
      assertEquals(columns.size(), row.size());
    }
    assertNull(reader.read());
  }

  @Test
  void materializedRowsAreUnmodifiable() {
    List<Object> row = RowMaterializer.materialize(Map.of("a", 1), ColumnGetters.forColumns(
        ProjectedColumn.of(List.of("a"))));
    assertThrows(UnsupportedOperationException.class, () -> row.add(2));
  }

  @Test
  void metadataUsesPublicNames() {
    ResultMetadata metadata = ResultMetadataBuilder.build(
        ProjectedColumn.of(List.of("timestamp___int", "page", "distinct___count")));
    assertEquals(3, metadata.getColumnCount());
    assertEquals(List.of("timestamp", "page", "count"), metadata.columnNames());
    assertNull(metadata.cols().get(0).baseType());
  }

  @Test
  void emptyReaderGivesEmptyStream() {
    RowReader reader = new InMemoryRowReader(List.of());
    assertEquals(0, RowMaterializer.materialize(reader, List.of()).count());
  }
}
