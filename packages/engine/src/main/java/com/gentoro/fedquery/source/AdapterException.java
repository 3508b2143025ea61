package com.gentoro.fedquery.source;

import com.gentoro.fedquery.exception.FedQueryErrorCode;
import com.gentoro.fedquery.exception.FedQueryException;
import com.gentoro.fedquery.plan.DataSourceKind;

/** Failure of a single adapter invocation. */
public class AdapterException extends FedQueryException {

  public enum Kind {
    /** The call did not finish before its deadline. */
    TIMEOUT(true),
    /** The backend could not be reached or dropped the connection. */
    CONNECTION_LOST(true),
    /** The payload is unsupported or unsafe; rejected before or by the backend parser. */
    INVALID_QUERY(false),
    /** The backend accepted the connection but refused or failed the query. */
    BACKEND_REJECTED(false);

    private final boolean retryable;

    Kind(boolean retryable) {
      this.retryable = retryable;
    }

    public boolean isRetryable() {
      return retryable;
    }
  }

  private final Kind kind;
  private final DataSourceKind dataSource;

  public AdapterException(Kind kind, DataSourceKind dataSource, String message) {
    this(kind, dataSource, message, null);
  }

  public AdapterException(Kind kind, DataSourceKind dataSource, String message, Throwable cause) {
    super(FedQueryErrorCode.ADAPTER_ERROR, message, cause);
    this.kind = kind;
    this.dataSource = dataSource;
    withContext("errorKind", kind.name());
    if (dataSource != null) {
      withContext("dataSource", dataSource.wireName());
    }
  }

  public Kind getKind() {
    return kind;
  }

  public DataSourceKind getDataSource() {
    return dataSource;
  }

  public boolean isRetryable() {
    return kind.isRetryable();
  }
}
