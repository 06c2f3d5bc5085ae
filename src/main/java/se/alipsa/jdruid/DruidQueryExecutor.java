package se.alipsa.jdruid;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.jdruid.engine.ColumnGetters;
import se.alipsa.jdruid.engine.NormalizedResult;
import se.alipsa.jdruid.engine.ProjectedColumn;
import se.alipsa.jdruid.engine.QueryType;
import se.alipsa.jdruid.engine.ResultMetadataBuilder;
import se.alipsa.jdruid.engine.ResultNormalizer;
import se.alipsa.jdruid.engine.RowMaterializer;
import se.alipsa.jdruid.engine.ValueGetter;
import se.alipsa.jdruid.helper.JDruidUtil;
import se.alipsa.jdruid.helper.TimezoneResolver;
import se.alipsa.jdruid.model.ColumnMetadata;
import se.alipsa.jdruid.model.ResultMetadata;

/**
 * Executes native queries and turns the query type specific engine payloads
 * into a uniform tabular result.
 *
 * <p>
 * An execution resolves the connection details, decodes the query body, runs
 * the engine round trip through the supplied {@link DruidClient}, normalizes
 * the payload and hands the column metadata and rows to a
 * {@link ResultCallback}. Executions share no mutable state, so one executor
 * may serve concurrent callers.
 * </p>
 */
public final class DruidQueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(DruidQueryExecutor.class);

  private final DetailsStore detailsStore;
  private final ColumnAnnotator annotator;

  /**
   * Create an executor that does not annotate result columns.
   *
   * @param detailsStore
   *          source of connection details
   */
  public DruidQueryExecutor(DetailsStore detailsStore) {
    this(detailsStore, ColumnAnnotator.identity());
  }

  /**
   * Create a new executor.
   *
   * @param detailsStore
   *          source of connection details
   * @param annotator
   *          enriches the result columns and decides their final order
   */
  public DruidQueryExecutor(DetailsStore detailsStore, ColumnAnnotator annotator) {
    this.detailsStore = Objects.requireNonNull(detailsStore, "detailsStore");
    this.annotator = Objects.requireNonNull(annotator, "annotator");
  }

  /**
   * Execute a query and pass the result to {@code respond}.
   *
   * @param context
   *          request scoped settings
   * @param query
   *          the query to execute
   * @param client
   *          performs the engine round trip
   * @param respond
   *          receives the result once all rows are decoded; not called when
   *          execution fails
   * @throws IllegalArgumentException
   *           if the query body is missing or the query type is unsupported
   * @throws IOException
   *           if the query body cannot be decoded or the engine round trip
   *           fails
   */
  public void execute(QueryContext context, NativeQuery query, DruidClient client, ResultCallback respond)
      throws IOException {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(respond, "respond");
    if (JDruidUtil.isBlankQuery(query.query())) {
      throw new IllegalArgumentException("A query body is required");
    }

    ConnectionDetails details = detailsStore.details(context.databaseId());
    JsonNode structured = JDruidUtil.decodeQuery(query.query());
    QueryType queryType = query.queryType() != null
        ? query.queryType()
        : QueryType.fromNativeName(structured.path("queryType").asText(null));
    Optional<ZoneId> timezone = TimezoneResolver.resolve(context.timezoneProvider());
    if (log.isDebugEnabled()) {
      log.debug("Executing {} query against {} (timezone conversion: {})", queryType.nativeName(),
          details.queryEndpoint(), timezone.map(ZoneId::getId).orElse("none"));
    }

    JsonNode results = client.execute(details, structured);
    NormalizedResult normalized = ResultNormalizer.normalize(queryType, query.projections(), timezone,
        query.middleware(), results);
    reduce(query, normalized, respond);
  }

  private void reduce(NativeQuery query, NormalizedResult normalized, ResultCallback respond) {
    List<ProjectedColumn> columns = query.mbql()
        ? ProjectedColumn.withoutTransient(ProjectedColumn.of(normalized.projections()))
        : ProjectedColumn.of(normalized.firstRowKeys());
    ResultMetadata minimal = ResultMetadataBuilder.build(columns);
    List<ColumnMetadata> annotated = annotator.annotate(query, minimal);
    if (annotated == null) {
      throw new IllegalStateException("Column annotation returned no columns");
    }
    ResultMetadata metadata = new ResultMetadata(annotated);
    List<String> names = metadata.columnNames();
    List<ValueGetter> getters = ColumnGetters.forColumnNames(names, columns);
    if (log.isDebugEnabled()) {
      log.debug("Result columns {}", names);
    }
    List<List<Object>> rows;
    try (Stream<List<Object>> materialized = RowMaterializer.materialize(normalized.rows(), getters)) {
      // decode failures must surface before the callback sees any row
      rows = materialized.collect(Collectors.toList());
    }
    respond.respond(metadata, rows.stream());
  }
}
