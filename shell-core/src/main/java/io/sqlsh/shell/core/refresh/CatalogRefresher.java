package io.sqlsh.shell.core.refresh;

import io.sqlsh.shell.core.completion.Catalog;
import io.sqlsh.shell.core.completion.RelationKind;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the completion catalog in the background and swaps it in when complete. Completion
 * requests keep reading the previous catalog until the new one is published, so a slow schema
 * query never blocks typing.
 *
 * <p>Refreshes run one at a time on a daemon thread. Requests made while a refresh is waiting to
 * start share that refresh; requests made while one is running queue a single follow-up run.
 * Closing fails the queued refresh, and {@link #refresh()} is rejected afterwards.
 */
public final class CatalogRefresher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CatalogRefresher.class);

  private final SchemaSource source;
  private final AtomicReference<Catalog> current;
  private final ExecutorService executor;
  private CompletableFuture<Catalog> pending;
  private boolean closed;

  /**
   * @param source schema rows to load
   * @param initial catalog published until the first refresh completes; its keyword extensions and
   *     special commands are carried over to every rebuilt catalog
   */
  public CatalogRefresher(SchemaSource source, Catalog initial) {
    this.source = Objects.requireNonNull(source, "source");
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    this.executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "sqlsh-completion-refresh");
              t.setDaemon(true);
              return t;
            });
  }

  /** The most recently published catalog. Usable as a {@code Supplier<Catalog>}. */
  public Catalog current() {
    return current.get();
  }

  /**
   * Schedules a rebuild.
   *
   * @return completes with the published catalog, or exceptionally if the source failed; on
   *     failure the previous catalog stays published
   * @throws IllegalStateException if the refresher has been closed
   */
  public synchronized CompletableFuture<Catalog> refresh() {
    if (closed) {
      throw new IllegalStateException("Completion refresher is closed");
    }
    if (pending != null) {
      log.debug("Completion refresh already scheduled");
      return pending;
    }
    CompletableFuture<Catalog> future = new CompletableFuture<>();
    try {
      executor.execute(() -> run(future));
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(e);
      return future;
    }
    pending = future;
    return future;
  }

  private void run(CompletableFuture<Catalog> future) {
    synchronized (this) {
      pending = null;
    }
    try {
      Catalog rebuilt = build(current.get());
      current.set(rebuilt);
      log.debug("Completion catalog refreshed");
      future.complete(rebuilt);
    } catch (Exception e) {
      log.warn("Failed to refresh completion catalog: {}", e.getMessage());
      log.debug("Refresh failure", e);
      future.completeExceptionally(e);
    }
  }

  private Catalog build(Catalog template) throws Exception {
    Catalog catalog = new Catalog();
    catalog.extendKeywords(template.keywordExtensions());
    catalog.extendSpecialCommands(template.specialCommands());
    catalog.extendDatabases(source.databases());
    catalog.extendRelations(source.tables(), RelationKind.TABLE);
    catalog.extendColumns(source.tableColumns(), RelationKind.TABLE);
    catalog.extendRelations(source.views(), RelationKind.VIEW);
    catalog.extendColumns(source.viewColumns(), RelationKind.VIEW);
    catalog.extendFunctions(source.functions());
    return catalog;
  }

  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      if (pending != null) {
        pending.completeExceptionally(
            new IllegalStateException("Completion refresher closed before refresh started"));
        pending = null;
      }
    }
    executor.shutdownNow();
  }
}
