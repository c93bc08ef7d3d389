/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Cursor over the values of a {@linkplain TransactionLog}, starting at a
 * given node and following either its {@code next} or {@code prev} links.
 * The cursor is independent of the log: it never mutates it. It cannot be
 * rewound; to traverse again, create a new cursor from a saved
 * {@linkplain Node}.
 */
public class LogCursor implements Iterator<String> {

  /**
   * Which link a cursor follows.
   */
  public enum Direction {
    /** Head to tail, following {@code next}. */
    FORWARD,
    /** Tail to head, following {@code prev}. */
    BACKWARD;
  }


  /**
   * Returns a cursor that walks toward the tail.
   *
   * @param start the first node visited; {@code null} for an exhausted cursor
   */
  public static LogCursor forward(Node start) {
    return new LogCursor(start, Direction.FORWARD);
  }

  /**
   * Returns a cursor that walks toward the head.
   *
   * @param start the first node visited; {@code null} for an exhausted cursor
   */
  public static LogCursor backward(Node start) {
    return new LogCursor(start, Direction.BACKWARD);
  }



  private final Direction direction;
  private Node current;


  /**
   * @param start     the first node visited (may be {@code null})
   * @param direction not null
   */
  public LogCursor(Node start, Direction direction) {
    if (direction == null)
      throw new IllegalArgumentException("null direction");
    this.direction = direction;
    this.current = start;
  }


  public Direction direction() {
    return direction;
  }


  /**
   * Returns the node the next call to {@linkplain #next()} will read, if any.
   */
  public Optional<Node> peek() {
    return Optional.ofNullable(current);
  }



  @Override
  public boolean hasNext() {
    return current != null;
  }


  /**
   * Returns the value at the cursor and advances it.
   *
   * @throws NoSuchElementException if the cursor is exhausted
   * @throws ConcurrentModificationException if the node at the cursor was
   *         popped from its log after the cursor reached it
   */
  @Override
  public String next() {
    if (current == null)
      throw new NoSuchElementException();
    if (!current.isLive())
      throw new ConcurrentModificationException(
          "node at cursor was removed from the log: " + current);

    String value = current.value();
    current = (direction == Direction.FORWARD ? current.next() : current.prev()).orElse(null);
    return value;
  }

}
