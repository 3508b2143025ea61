package com.gentoro.fedquery.engine;

/** A second value was published under an output variable that already has one. */
public class DuplicateOutputException extends InternalConsistencyException {
  private final String outputVar;

  public DuplicateOutputException(String outputVar) {
    super("Output variable '" + outputVar + "' has already been published");
    this.outputVar = outputVar;
    withContext("outputVar", outputVar);
  }

  public String getOutputVar() {
    return outputVar;
  }
}
