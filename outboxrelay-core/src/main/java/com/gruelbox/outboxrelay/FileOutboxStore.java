package com.gruelbox.outboxrelay;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import lombok.Builder;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable {@link OutboxStore} backed by a flat text file with one record per line (see {@link
 * EventFormat}).
 *
 * <ul>
 *   <li>{@link #append(OutboxEvent)} writes a single complete record in append mode and forces it
 *       to the device before returning. If an earlier append was torn by a crash, a line break is
 *       written first so the fragment stays on its own line.
 *   <li>Status changes read the whole file, modify it, write the result to a temporary file in the
 *       same directory and atomically rename it over the original, so a crash leaves either the
 *       old or the new sequence, never a truncated one.
 *   <li>Records which cannot be parsed are logged and skipped by scans. Rewrites keep them
 *       verbatim so they remain available for inspection.
 *   <li>Duplicate ids found on read are collapsed; the first record wins.
 * </ul>
 *
 * <p>All operations are serialized by a lock held for the whole read-modify-write cycle. The file
 * must not be shared between processes.
 */
@Slf4j
@ToString(onlyExplicitlyIncluded = true)
public final class FileOutboxStore implements OutboxStore, Validatable {

  private static final String TEMP_SUFFIX = ".tmp";

  @ToString.Include private final Path path;
  private final Path tempPath;
  @ToString.Include private final EventFormat format;
  private final boolean syncWrites;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * @param path The log file. Created along with any missing parent directories on {@link
   *     #initialize()}.
   * @param format The record format. Defaults to {@link EventFormat#delimited()}.
   * @param syncWrites Whether each write is forced to the storage device before returning.
   *     Defaults to true. Only disable this for tests.
   */
  @Builder
  private FileOutboxStore(Path path, EventFormat format, Boolean syncWrites) {
    this.path = path;
    this.tempPath = path == null ? null : path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
    this.format = Utils.firstNonNull(format, EventFormat::delimited);
    this.syncWrites = syncWrites == null || syncWrites;
    new Validator().validate(this);
  }

  /**
   * Shortcut for {@code FileOutboxStore.builder().path(path).build()}.
   *
   * @param path The log file.
   * @return The store.
   */
  public static FileOutboxStore at(Path path) {
    return builder().path(path).build();
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("path", path);
    validator.notNull("format", format);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public void initialize() throws OutboxStoreIoException {
    lock.lock();
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (Files.deleteIfExists(tempPath)) {
        log.warn("Discarded incomplete rewrite left at {}", tempPath);
      }
      if (!Files.exists(path)) {
        Files.createFile(path);
        log.info("Created outbox log at {}", path);
      }
      if (!Files.isRegularFile(path) || !Files.isReadable(path) || !Files.isWritable(path)) {
        throw new OutboxStoreIoException(
            "Outbox log " + path + " is not a readable and writable file", null);
      }
    } catch (IOException e) {
      throw new OutboxStoreIoException("Could not prepare outbox log at " + path, e);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void append(OutboxEvent event) throws DuplicateEventException, OutboxStoreIoException {
    InMemoryOutboxStore.requirePending(event);
    byte[] record = (format.format(event) + "\n").getBytes(UTF_8);
    lock.lock();
    try {
      Contents contents = read();
      if (contents.ids().contains(event.getId())) {
        throw new DuplicateEventException(event.getId());
      }
      try (FileChannel channel = FileChannel.open(path, CREATE, WRITE, APPEND)) {
        if (!contents.endsWithNewline) {
          log.warn("Outbox log {} ends with a partial record; starting a new line", path);
          writeFully(channel, ByteBuffer.wrap(new byte[] {'\n'}));
        }
        writeFully(channel, ByteBuffer.wrap(record));
        if (syncWrites) {
          channel.force(false);
        }
      }
    } catch (IOException e) {
      throw new OutboxStoreIoException("Failed to append " + event.getId() + " to " + path, e);
    } finally {
      lock.unlock();
    }
    log.debug("Appended {}", event.description());
  }

  @Override
  public PendingEvents listPending() throws OutboxStoreIoException {
    Contents contents = lockedRead();
    List<OutboxEvent> pending = new ArrayList<>();
    for (OutboxEvent event : contents.events) {
      if (event.isPending()) {
        pending.add(event);
      }
    }
    return PendingEvents.of(pending, contents.skipped);
  }

  @Override
  public void markProcessed(String id) throws EventNotFoundException, OutboxStoreIoException {
    transition(id, OutboxEvent::processed);
  }

  @Override
  public void markFailed(String id, String reason)
      throws EventNotFoundException, OutboxStoreIoException {
    transition(id, event -> event.failed(reason));
  }

  private void transition(String id, UnaryOperator<OutboxEvent> change)
      throws EventNotFoundException, OutboxStoreIoException {
    lock.lock();
    try {
      Contents contents = read();
      int index = contents.indexOf(id);
      if (index < 0) {
        throw new EventNotFoundException(id);
      }
      Line line = contents.lines.get(index);
      OutboxEvent updated = change.apply(line.event);
      if (updated.equals(line.event)) {
        return;
      }
      contents.lines.set(index, Line.of(format, updated));
      rewrite(contents.lines);
      log.debug("Updated {}", updated.description());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<OutboxEvent> find(String id) throws OutboxStoreIoException {
    Contents contents = lockedRead();
    int index = contents.indexOf(id);
    return index < 0 ? Optional.empty() : Optional.of(contents.lines.get(index).event);
  }

  @Override
  public List<OutboxEvent> listFailed() throws OutboxStoreIoException {
    List<OutboxEvent> failed = new ArrayList<>();
    for (OutboxEvent event : lockedRead().events) {
      if (event.getStatus() == EventStatus.FAILED) {
        failed.add(event);
      }
    }
    return List.copyOf(failed);
  }

  @Override
  public int deleteProcessed() throws OutboxStoreIoException {
    lock.lock();
    try {
      Contents contents = read();
      List<Line> retained = new ArrayList<>(contents.lines.size());
      for (Line line : contents.lines) {
        if (line.event == null || line.event.getStatus() != EventStatus.PROCESSED) {
          retained.add(line);
        }
      }
      int removed = contents.lines.size() - retained.size();
      if (removed > 0) {
        rewrite(retained);
        log.debug("Removed {} processed events from {}", removed, path);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() throws OutboxStoreIoException {
    lock.lock();
    try {
      rewrite(List.of());
    } finally {
      lock.unlock();
    }
  }

  private Contents lockedRead() throws OutboxStoreIoException {
    lock.lock();
    try {
      return read();
    } finally {
      lock.unlock();
    }
  }

  private Contents read() throws OutboxStoreIoException {
    byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return new Contents(List.of(), true);
    } catch (IOException e) {
      throw new OutboxStoreIoException("Failed to read outbox log " + path, e);
    }
    String text = new String(data, UTF_8);
    List<Line> lines = new ArrayList<>();
    int start = 0;
    int number = 0;
    while (start < text.length()) {
      int end = text.indexOf('\n', start);
      if (end < 0) {
        end = text.length();
      }
      number++;
      String raw = text.substring(start, end);
      if (raw.endsWith("\r")) {
        raw = raw.substring(0, raw.length() - 1);
      }
      if (!raw.isEmpty()) {
        lines.add(parse(number, raw));
      }
      start = end + 1;
    }
    return new Contents(lines, data.length == 0 || data[data.length - 1] == '\n');
  }

  private Line parse(int number, String raw) {
    try {
      return new Line(raw, format.parse(raw));
    } catch (EventParseException e) {
      log.warn("Skipping corrupt record at {}:{}: {}", path, number, e.getMessage());
      return new Line(raw, null);
    }
  }

  private void rewrite(List<Line> lines) throws OutboxStoreIoException {
    StringBuilder sb = new StringBuilder();
    for (Line line : lines) {
      sb.append(line.raw).append('\n');
    }
    try {
      try (FileChannel channel = FileChannel.open(tempPath, CREATE, WRITE, TRUNCATE_EXISTING)) {
        writeFully(channel, ByteBuffer.wrap(sb.toString().getBytes(UTF_8)));
        if (syncWrites) {
          channel.force(true);
        }
      }
      try {
        Files.move(
            tempPath,
            path,
            StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}; replacing non-atomically", path);
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      Utils.safelyRun("removing temporary outbox log", () -> Files.deleteIfExists(tempPath));
      throw new OutboxStoreIoException("Failed to rewrite outbox log " + path, e);
    }
  }

  private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
    while (buffer.hasRemaining()) {
      channel.write(buffer);
    }
  }

  /** One non-blank line of the file. {@code event} is null if the record is corrupt. */
  private static final class Line {
    private final String raw;
    private final OutboxEvent event;

    Line(String raw, OutboxEvent event) {
      this.raw = raw;
      this.event = event;
    }

    static Line of(EventFormat format, OutboxEvent event) {
      return new Line(format.format(event), event);
    }
  }

  /** The parsed file. {@code events} holds the first record for each id, in file order. */
  private static final class Contents {
    private final List<Line> lines;
    private final List<OutboxEvent> events = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private final boolean endsWithNewline;
    private final int skipped;

    Contents(List<Line> lines, boolean endsWithNewline) {
      this.lines = new ArrayList<>(lines);
      this.endsWithNewline = endsWithNewline;
      int skippedCount = 0;
      for (Line line : lines) {
        if (line.event == null) {
          skippedCount++;
        } else if (ids.add(line.event.getId())) {
          events.add(line.event);
        } else {
          log.warn("Skipping duplicate record for event {}", line.event.getId());
          skippedCount++;
        }
      }
      this.skipped = skippedCount;
    }

    Set<String> ids() {
      return ids;
    }

    int indexOf(String id) {
      for (int i = 0; i < lines.size(); i++) {
        OutboxEvent event = lines.get(i).event;
        if (event != null && event.getId().equals(id)) {
          return i;
        }
      }
      return -1;
    }
  }
}
