package com.gentoro.fedquery.engine;

import com.gentoro.fedquery.data.RowSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Results of one plan execution, keyed by output variable. Each key is written at most once; the
 * first value always wins.
 */
public class ResultStore {
  private final Map<String, RowSet> results = new ConcurrentHashMap<>();

  /**
   * @throws DuplicateOutputException when {@code outputVar} already holds a value, which is kept
   */
  public void publish(String outputVar, RowSet rows) {
    if (results.putIfAbsent(outputVar, rows == null ? RowSet.empty() : rows) != null) {
      throw new DuplicateOutputException(outputVar);
    }
  }

  /**
   * @throws InternalConsistencyException when nothing has been published under {@code outputVar}
   */
  public RowSet get(String outputVar) {
    RowSet rows = results.get(outputVar);
    if (rows == null) {
      throw new InternalConsistencyException(
          "Output variable '" + outputVar + "' is not available yet");
    }
    return rows;
  }

  public boolean contains(String outputVar) {
    return results.containsKey(outputVar);
  }

  public Set<String> publishedVariables() {
    return Set.copyOf(results.keySet());
  }
}
