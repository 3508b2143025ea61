package com.gentoro.fedquery.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.fedquery.utility.JacksonUtility;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one unit of work in a {@link Plan}.
 *
 * <p>A step either sends an opaque, backend-native {@code query} to the adapter selected by its
 * {@link DataSourceKind}, or applies a {@link MemoryOperation} to the row sets published under
 * its {@code inputs}. The result is published under {@code outputVar}.
 *
 * <p>JSON payloads are deep-copied on the way in and on the way out so a step cannot be changed
 * after construction.
 */
public final class Step {
  private final String id;
  private final int index;
  private final StepKind kind;
  private final DataSourceKind dataSource;
  private final JsonNode query;
  private final List<String> inputs;
  private final MemoryOperation operation;
  private final ObjectNode parameters;
  private final String outputVar;

  public Step(
      String id,
      int index,
      StepKind kind,
      DataSourceKind dataSource,
      JsonNode query,
      List<String> inputs,
      MemoryOperation operation,
      ObjectNode parameters,
      String outputVar) {
    this.id = Objects.requireNonNull(id, "id");
    this.index = index;
    this.kind = kind;
    this.dataSource = dataSource;
    this.query = query == null ? null : query.deepCopy();
    this.inputs = inputs == null ? List.of() : List.copyOf(inputs);
    this.operation = operation;
    this.parameters =
        parameters == null
            ? JacksonUtility.getJsonMapper().createObjectNode()
            : parameters.deepCopy();
    this.outputVar = outputVar;
  }

  public String getId() {
    return id;
  }

  /** Position in the plan's declared step list; used to break ties between ready steps. */
  public int getIndex() {
    return index;
  }

  public StepKind getKind() {
    return kind;
  }

  public DataSourceKind getDataSource() {
    return dataSource;
  }

  /** Backend payload, or {@code null} for memory steps. Returns a copy. */
  public JsonNode getQuery() {
    return query == null ? null : query.deepCopy();
  }

  public List<String> getInputs() {
    return inputs;
  }

  /** Memory operation, or {@code null} for backend steps. */
  public MemoryOperation getOperation() {
    return operation;
  }

  /** Operation parameters; never null. Returns a copy. */
  public ObjectNode getParameters() {
    return parameters.deepCopy();
  }

  public String getOutputVar() {
    return outputVar;
  }

  public boolean isBackendQuery() {
    return dataSource != null && dataSource.isBackend();
  }

  public boolean isFinal() {
    return kind == StepKind.FINAL;
  }

  @Override
  public String toString() {
    return "Step{id='%s', kind=%s, dataSource=%s, output='%s'}"
        .formatted(id, kind, dataSource == null ? null : dataSource.wireName(), outputVar);
  }
}
