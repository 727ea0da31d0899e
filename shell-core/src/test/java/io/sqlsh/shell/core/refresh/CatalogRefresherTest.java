package io.sqlsh.shell.core.refresh;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.sqlsh.shell.core.completion.Catalog;
import io.sqlsh.shell.core.completion.RelationKind;
import io.sqlsh.shell.core.completion.UnknownRelationException;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogRefresherTest {

  private SchemaSource source;
  private Catalog initial;
  private CatalogRefresher refresher;

  @BeforeEach
  void setUp() throws Exception {
    source = mock(SchemaSource.class);
    when(source.databases()).thenReturn(List.of("sales"));
    when(source.tables()).thenReturn(List.of("orders"));
    when(source.tableColumns())
        .thenReturn(List.of(Map.entry("orders", "id"), Map.entry("orders", "total")));
    when(source.views()).thenReturn(List.of("big_orders"));
    when(source.viewColumns()).thenReturn(List.of(Map.entry("big_orders", "id")));
    when(source.functions()).thenReturn(List.of(Map.entry("public", "order_total")));

    initial = new Catalog();
    initial.extendKeywords(List.of("EXPLAIN"));
    initial.extendSpecialCommands(List.of("\\dt"));
    refresher = new CatalogRefresher(source, initial);
  }

  @AfterEach
  void tearDown() {
    refresher.close();
  }

  @Test
  void publishesInitialCatalogUntilRefreshed() {
    assertSame(initial, refresher.current());
  }

  @Test
  void refreshBuildsCatalogFromSource() throws Exception {
    Catalog rebuilt = refresher.refresh().get(5, TimeUnit.SECONDS);

    assertSame(rebuilt, refresher.current());
    assertNotSame(initial, rebuilt);
    assertEquals(List.of("sales"), rebuilt.databases());
    assertEquals(
        Optional.of(List.of("*", "id", "total")), rebuilt.columns(RelationKind.TABLE, "orders"));
    assertEquals(Optional.of(List.of("*", "id")), rebuilt.columns(RelationKind.VIEW, "big_orders"));
    assertEquals(Set.of("order_total"), rebuilt.functionNames());
  }

  @Test
  void carriesOverSessionVocabulary() throws Exception {
    Catalog rebuilt = refresher.refresh().get(5, TimeUnit.SECONDS);
    assertEquals(List.of("EXPLAIN"), rebuilt.keywordExtensions());
    assertEquals(List.of("\\dt"), rebuilt.specialCommands());
  }

  @Test
  void failedRefreshKeepsPreviousCatalog() throws Exception {
    when(source.tables()).thenThrow(new SQLException("connection lost"));

    CompletableFuture<Catalog> future = refresher.refresh();

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    assertInstanceOf(SQLException.class, e.getCause());
    assertSame(initial, refresher.current());
  }

  @Test
  void columnsForUnknownRelationFailTheRefresh() throws Exception {
    when(source.tableColumns()).thenReturn(List.of(Map.entry("ghost", "id")));

    ExecutionException e =
        assertThrows(
            ExecutionException.class, () -> refresher.refresh().get(5, TimeUnit.SECONDS));
    assertInstanceOf(UnknownRelationException.class, e.getCause());
    assertSame(initial, refresher.current());
  }

  @Test
  void requestsWhileQueuedShareOneRefresh() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(source.databases())
        .thenAnswer(
            inv -> {
              started.countDown();
              release.await(5, TimeUnit.SECONDS);
              return List.of("sales");
            })
        .thenReturn(List.of("sales"));

    CompletableFuture<Catalog> running = refresher.refresh();
    assertTrue(started.await(5, TimeUnit.SECONDS));

    CompletableFuture<Catalog> queued = refresher.refresh();
    CompletableFuture<Catalog> coalesced = refresher.refresh();
    assertSame(queued, coalesced);
    assertNotSame(running, queued);

    release.countDown();
    Catalog first = running.get(5, TimeUnit.SECONDS);
    Catalog second = queued.get(5, TimeUnit.SECONDS);
    assertNotSame(first, second);
    assertSame(second, refresher.current());
  }

  @Test
  void refreshAfterCloseIsRejected() {
    refresher.close();

    assertThrows(IllegalStateException.class, refresher::refresh);
    assertThrows(IllegalStateException.class, refresher::refresh);
    assertSame(initial, refresher.current());
  }

  @Test
  void closeFailsQueuedRefresh() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(source.databases())
        .thenAnswer(
            inv -> {
              started.countDown();
              release.await(5, TimeUnit.SECONDS);
              return List.of("sales");
            });

    CompletableFuture<Catalog> running = refresher.refresh();
    assertTrue(started.await(5, TimeUnit.SECONDS));
    CompletableFuture<Catalog> queued = refresher.refresh();

    refresher.close();

    assertTrue(queued.isCompletedExceptionally());
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> queued.get(5, TimeUnit.SECONDS));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    release.countDown();
    assertDoesNotThrow(() -> running.handle((c, t) -> c).get(5, TimeUnit.SECONDS));
  }
}
