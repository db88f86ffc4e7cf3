package io.github.wphillipmoore.nd.api.gui;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity ring buffer of (status code, request path) pairs, most recent first.
 *
 * <p>Once full, each new entry overwrites the oldest one. Not thread-safe.
 */
public final class RequestHistory {

  /** Default capacity used by {@link ControllerSession}. */
  public static final int DEFAULT_CAPACITY = 50;

  /**
   * One recorded call.
   *
   * @param statusCode the HTTP status code
   * @param path the request path
   */
  public record Entry(int statusCode, String path) {

    /** Validates that path is non-null. */
    public Entry {
      Objects.requireNonNull(path, "path");
    }
  }

  private final Entry[] slots;
  private int next;
  private int size;

  /** Creates a history with {@link #DEFAULT_CAPACITY}. */
  public RequestHistory() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a history with the given capacity.
   *
   * @param capacity maximum number of entries retained (must be &gt; 0)
   * @throws IllegalArgumentException if capacity is not positive
   */
  public RequestHistory(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.slots = new Entry[capacity];
  }

  /** Records a call, dropping the oldest entry if the buffer is full. */
  public void add(int statusCode, String path) {
    slots[next] = new Entry(statusCode, path);
    next = (next + 1) % slots.length;
    if (size < slots.length) {
      size++;
    }
  }

  /** Returns a snapshot of the entries, most recent first. */
  public List<Entry> entries() {
    List<Entry> result = new ArrayList<>(size);
    for (int offset = 1; offset <= size; offset++) {
      result.add(slots[Math.floorMod(next - offset, slots.length)]);
    }
    return result;
  }

  /** Returns the status codes, most recent first. */
  public List<Integer> statusCodes() {
    List<Integer> result = new ArrayList<>(size);
    for (Entry entry : entries()) {
      result.add(entry.statusCode());
    }
    return result;
  }

  /** Returns the request paths, most recent first. */
  public List<String> paths() {
    List<String> result = new ArrayList<>(size);
    for (Entry entry : entries()) {
      result.add(entry.path());
    }
    return result;
  }

  /** Returns the number of entries currently held. */
  public int size() {
    return size;
  }

  /** Returns the maximum number of entries retained. */
  public int capacity() {
    return slots.length;
  }
}
