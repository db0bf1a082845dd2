package org.workerwatch.alert.engine.metric.anomaly.datamodel.source;

import com.google.common.base.Preconditions;
import java.util.Optional;
import org.workerwatch.alert.engine.metric.anomaly.datamodel.MetricSnapshot;

/**
 * Outcome of a single fetch against a metric source: a snapshot, no data in range, or a
 * transport level failure.
 */
public final class MetricFetchResult<S extends MetricSnapshot> {

  public enum Status {
    SUCCESS,
    EMPTY,
    TRANSPORT_ERROR
  }

  private final Status status;
  private final S snapshot;
  private final Throwable error;

  private MetricFetchResult(Status status, S snapshot, Throwable error) {
    this.status = status;
    this.snapshot = snapshot;
    this.error = error;
  }

  public static <S extends MetricSnapshot> MetricFetchResult<S> success(S snapshot) {
    Preconditions.checkArgument(snapshot != null, "snapshot is required");
    return new MetricFetchResult<>(Status.SUCCESS, snapshot, null);
  }

  public static <S extends MetricSnapshot> MetricFetchResult<S> empty() {
    return new MetricFetchResult<>(Status.EMPTY, null, null);
  }

  public static <S extends MetricSnapshot> MetricFetchResult<S> transportError(Throwable error) {
    Preconditions.checkArgument(error != null, "error is required");
    return new MetricFetchResult<>(Status.TRANSPORT_ERROR, null, error);
  }

  public Status getStatus() {
    return status;
  }

  public Optional<S> getSnapshot() {
    return Optional.ofNullable(snapshot);
  }

  public Optional<Throwable> getError() {
    return Optional.ofNullable(error);
  }

  public boolean isTransportError() {
    return status == Status.TRANSPORT_ERROR;
  }

  @Override
  public String toString() {
    switch (status) {
      case SUCCESS:
        return "MetricFetchResult{SUCCESS, " + snapshot + "}";
      case TRANSPORT_ERROR:
        return "MetricFetchResult{TRANSPORT_ERROR, " + error + "}";
      default:
        return "MetricFetchResult{EMPTY}";
    }
  }
}
