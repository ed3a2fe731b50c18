package ca.gc.cra.relay.application.invocation;

import ca.gc.cra.relay.domain.content.Manifest;
import ca.gc.cra.relay.domain.contract.ChildService;
import ca.gc.cra.relay.domain.invocation.Outcome;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Logical call spanning every attempt made for one question. Completed exactly once.
 */
final class PendingCall {
  private final ChildService child;
  private final Object inputValues;
  private final Manifest inputManifest;
  private final InvocationOptions options;
  private final CompletableFuture<Outcome> future = new CompletableFuture<>();
  private final List<String> correlationIds = new CopyOnWriteArrayList<>();
  private volatile FragmentAssembler assembler;
  private volatile int retriesUsed;
  private volatile boolean cancelled;

  PendingCall(ChildService child, Object inputValues, Manifest inputManifest, InvocationOptions options) {
    this.child = child;
    this.inputValues = inputValues;
    this.inputManifest = inputManifest;
    this.options = options;
  }

  ChildService child() {
    return child;
  }

  Object inputValues() {
    return inputValues;
  }

  Manifest inputManifest() {
    return inputManifest;
  }

  InvocationOptions options() {
    return options;
  }

  CompletableFuture<Outcome> future() {
    return future;
  }

  List<String> correlationIds() {
    return List.copyOf(correlationIds);
  }

  String currentCorrelationId() {
    return correlationIds.isEmpty() ? null : correlationIds.get(correlationIds.size() - 1);
  }

  FragmentAssembler assembler() {
    return assembler;
  }

  void beginAttempt(String correlationId, FragmentAssembler attemptAssembler) {
    correlationIds.add(correlationId);
    assembler = attemptAssembler;
  }

  void abandonAttempt(String correlationId) {
    correlationIds.remove(correlationId);
  }

  int retriesRemaining() {
    return options.retryPolicy().maxRetries() - retriesUsed;
  }

  /** Consumes one retry and returns its 1-based ordinal. */
  synchronized int nextRetry() {
    retriesUsed++;
    return retriesUsed;
  }

  boolean isDone() {
    return future.isDone();
  }

  boolean isCancelled() {
    return cancelled;
  }

  void markCancelled() {
    cancelled = true;
  }
}
