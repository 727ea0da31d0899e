package io.sqlsh.shell.core.completion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory snapshot of the schema and vocabulary used to answer completion requests.
 *
 * <p>Relation, column and function names are stored escaped (see {@link NameCodec}). Every table
 * or view starts with a single {@value #UNKNOWN_COLUMNS} column meaning "columns unknown"; real
 * columns are appended after it and the sentinel is never removed.
 *
 * <p>The catalog is refreshed wholesale with {@link #reset()} followed by a batch of {@code
 * extend*} calls. {@link #reload(Consumer)} loads such a batch into a staging catalog and swaps the
 * result in under the write lock, so readers never observe a half-loaded catalog. A request that
 * reads several parts of the catalog goes through {@link #read(Function)} to see them from the same
 * load. All accessors return immutable copies.
 */
public final class Catalog {
  private static final Logger log = LoggerFactory.getLogger(Catalog.class);

  /** Column placeholder registered with every relation. */
  public static final String UNKNOWN_COLUMNS = "*";

  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final List<String> databases = new ArrayList<>();
  private final Map<RelationKind, Map<String, List<String>>> relations =
      new EnumMap<>(RelationKind.class);
  private final Map<String, Map<String, FunctionMetadata>> functions = new HashMap<>();

  /** Per-session keywords on top of {@link SqlVocabulary#KEYWORDS}. */
  private final List<String> keywordExtensions = new ArrayList<>();

  /** Meta-commands; never part of {@link #vocabulary}. */
  private final List<String> specialCommands = new ArrayList<>();

  /** Every literal completable in dumb mode. */
  private final Set<String> vocabulary = new HashSet<>();

  public Catalog() {
    for (RelationKind kind : RelationKind.values()) {
      relations.put(kind, new HashMap<>());
    }
    resetVocabulary();
  }

  /**
   * Clears databases, relations and functions, and resets the vocabulary to the built-in keywords
   * and functions. Keyword extensions and special commands are kept in their own lists.
   */
  public void reset() {
    lock.writeLock().lock();
    try {
      databases.clear();
      relations.values().forEach(Map::clear);
      functions.clear();
      resetVocabulary();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Replaces the schema with what {@code loader} registers.
   *
   * <p>The loader runs against a fresh staging catalog that starts with this catalog's keyword
   * extensions and special commands. Its content is swapped in under the write lock once the
   * loader returns. If the loader throws, this catalog is left unchanged.
   *
   * @param loader receives the staging catalog and issues the {@code extend*} calls
   */
  public void reload(Consumer<Catalog> loader) {
    Objects.requireNonNull(loader, "loader");
    Catalog staged = new Catalog();
    staged.extendKeywords(keywordExtensions());
    staged.extendSpecialCommands(specialCommands());
    staged.resetVocabulary();
    loader.accept(staged);

    lock.writeLock().lock();
    try {
      databases.clear();
      databases.addAll(staged.databases);
      for (RelationKind kind : RelationKind.values()) {
        relations.get(kind).clear();
        relations.get(kind).putAll(staged.relations.get(kind));
      }
      functions.clear();
      functions.putAll(staged.functions);
      keywordExtensions.clear();
      keywordExtensions.addAll(staged.keywordExtensions);
      specialCommands.clear();
      specialCommands.addAll(staged.specialCommands);
      vocabulary.clear();
      vocabulary.addAll(staged.vocabulary);
      log.debug(
          "Catalog reloaded: {} databases, {} tables, {} views, {} function schemas",
          databases.size(),
          relations.get(RelationKind.TABLE).size(),
          relations.get(RelationKind.VIEW).size(),
          functions.size());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Runs {@code reader} while holding the read lock, so every accessor it calls sees the same
   * catalog content. Mutations from other threads wait until it returns.
   *
   * @param reader reads from this catalog; must not mutate it
   * @return the reader's result
   */
  public <T> T read(Function<Catalog, T> reader) {
    lock.readLock().lock();
    try {
      return reader.apply(this);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Appends escaped database names in the given order. Duplicates are kept. */
  public void extendDatabases(Collection<String> names) {
    lock.writeLock().lock();
    try {
      databases.addAll(NameCodec.escapeAll(names));
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Registers relations of the given kind. An already registered name is overwritten, dropping any
   * columns collected for it.
   */
  public void extendRelations(Collection<String> names, RelationKind kind) {
    Objects.requireNonNull(kind, "kind");
    lock.writeLock().lock();
    try {
      Map<String, List<String>> metadata = relations.get(kind);
      for (String relation : NameCodec.escapeAll(names)) {
        List<String> columns = new ArrayList<>();
        columns.add(UNKNOWN_COLUMNS);
        metadata.put(relation, columns);
        vocabulary.add(relation);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Appends columns to relations previously registered with {@link #extendRelations}.
   *
   * @param columns (relation name, column name) pairs
   * @param kind map the relations belong to
   * @throws UnknownRelationException if a relation is not registered under {@code kind}; pairs
   *     before the failing one stay applied
   */
  public void extendColumns(
      Collection<? extends Map.Entry<String, String>> columns, RelationKind kind) {
    Objects.requireNonNull(kind, "kind");
    lock.writeLock().lock();
    try {
      Map<String, List<String>> metadata = relations.get(kind);
      for (Map.Entry<String, String> pair : columns) {
        String relation = NameCodec.escape(pair.getKey());
        String column = NameCodec.escape(pair.getValue());
        List<String> existing = metadata.get(relation);
        if (existing == null) {
          throw new UnknownRelationException(relation, kind);
        }
        existing.add(column);
        vocabulary.add(column);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Registers functions by schema.
   *
   * @param schemaFunctions (schema name, function name) pairs
   */
  public void extendFunctions(Collection<? extends Map.Entry<String, String>> schemaFunctions) {
    lock.writeLock().lock();
    try {
      for (Map.Entry<String, String> pair : schemaFunctions) {
        String schema = NameCodec.escape(pair.getKey());
        String function = NameCodec.escape(pair.getValue());
        functions
            .computeIfAbsent(schema, s -> new HashMap<>())
            .put(function, FunctionMetadata.PLACEHOLDER);
        vocabulary.add(function);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Adds session keywords. The built-in keyword list itself is never modified. */
  public void extendKeywords(Collection<String> words) {
    lock.writeLock().lock();
    try {
      keywordExtensions.addAll(words);
      vocabulary.addAll(words);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Adds meta-commands. They are only valid at the start of a line, so they stay out of the dumb
   * mode vocabulary.
   */
  public void extendSpecialCommands(Collection<String> commands) {
    lock.writeLock().lock();
    try {
      specialCommands.addAll(commands);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public List<String> databases() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(databases));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Built-in keywords followed by session keywords. */
  public List<String> keywords() {
    lock.readLock().lock();
    try {
      List<String> all = new ArrayList<>(SqlVocabulary.KEYWORDS);
      all.addAll(keywordExtensions);
      return Collections.unmodifiableList(all);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Keywords added with {@link #extendKeywords}, in insertion order. */
  public List<String> keywordExtensions() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(keywordExtensions));
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<String> specialCommands() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableList(new ArrayList<>(specialCommands));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Escaped names of all registered relations of {@code kind}. */
  public Set<String> relationNames(RelationKind kind) {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableSet(new LinkedHashSet<>(relations.get(kind).keySet()));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Columns of a relation, sentinel first.
   *
   * @param kind relation kind
   * @param escapedName relation name as stored, i.e. already escaped
   * @return the column list, or empty if the relation is not registered under {@code kind}
   */
  public Optional<List<String>> columns(RelationKind kind, String escapedName) {
    lock.readLock().lock();
    try {
      List<String> columns = relations.get(kind).get(escapedName);
      return columns == null
          ? Optional.empty()
          : Optional.of(Collections.unmodifiableList(new ArrayList<>(columns)));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Distinct function names across all schemas. */
  public Set<String> functionNames() {
    lock.readLock().lock();
    try {
      Set<String> names = new TreeSet<>();
      functions.values().forEach(bySchema -> names.addAll(bySchema.keySet()));
      return Collections.unmodifiableSet(names);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Functions keyed by escaped schema name, then escaped function name. */
  public Map<String, Map<String, FunctionMetadata>> functionsBySchema() {
    lock.readLock().lock();
    try {
      Map<String, Map<String, FunctionMetadata>> copy = new HashMap<>();
      functions.forEach((schema, fns) -> copy.put(schema, Map.copyOf(fns)));
      return Collections.unmodifiableMap(copy);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Every literal known to the catalog except special commands. */
  public Set<String> vocabulary() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableSet(new HashSet<>(vocabulary));
    } finally {
      lock.readLock().unlock();
    }
  }

  private void resetVocabulary() {
    vocabulary.clear();
    vocabulary.addAll(SqlVocabulary.KEYWORDS);
    vocabulary.addAll(SqlVocabulary.FUNCTIONS);
  }
}
