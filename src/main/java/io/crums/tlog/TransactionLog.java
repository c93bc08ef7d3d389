/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import static io.crums.tlog.TlogConstants.NIL;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A FIFO log of string entries, doubly linked. Entries are appended at the
 * tail and popped from the head; the log can be walked in either direction
 * without draining it.
 *
 * <h3>Storage</h3>
 * <p>
 * Nodes live in a {@linkplain NodeArena} owned by this instance, and link to
 * one another by slot index. A node's slot is only released after every
 * link to it has been dropped: this is checked on every {@linkplain #pop()}
 * and a failure is reported as a {@linkplain DanglingLinkError}.
 * </p>
 * <h3>Not thread-safe</h3>
 * <p>
 * Instances are meant to be confined to a single thread.
 * </p>
 */
public class TransactionLog implements Iterable<String> {

  private final NodeArena arena;

  private int head = NIL;
  private int tail = NIL;
  private long length;


  /**
   * Creates an empty instance with the {@linkplain TlogConstants#DEFAULT_CAPACITY
   * default} initial capacity.
   */
  public TransactionLog() {
    this(TlogConstants.DEFAULT_CAPACITY);
  }

  /**
   * Creates an empty instance.
   *
   * @param initCapacity number of node slots to preallocate (&ge; 0). The log
   *                     grows past this as needed.
   */
  public TransactionLog(int initCapacity) {
    this.arena = new NodeArena(initCapacity);
  }



  /**
   * Appends the given value at the tail.
   *
   * @param value not null
   */
  public void append(String value) {
    int node = arena.allocate(value);
    if (tail == NIL) {
      head = node;
    } else {
      arena.setNext(tail, node);
      arena.setPrev(node, tail);
    }
    tail = node;
    ++length;
  }


  /**
   * Removes the entry at the head and returns its value.
   *
   * @return the head value, or empty if the log is empty
   *
   * @throws DanglingLinkError if, once unlinked, the removed node is still
   *         referenced (a bug)
   */
  public Optional<String> pop() {
    if (head == NIL)
      return Optional.empty();

    final int popped = head;
    final int successor = arena.next(popped);
    arena.setNext(popped, NIL);

    if (successor != NIL) {
      clearBackLink(successor);
      head = successor;
    } else {
      head = NIL;
      tail = NIL;
    }
    --length;
    return Optional.of(reclaim(popped, successor));
  }


  /**
   * Drops the new head's back link to the node being popped. Skipping this
   * leaves the popped node with a second holder, and the pop fails.
   * <p>
   * Package-private, for tests: overridden only to check that a skipped
   * unlink is caught. Not an extension point.
   * </p>
   */
  void clearBackLink(int successor) {
    arena.setPrev(successor, NIL);
  }


  private String reclaim(int popped, int formerSuccessor) {
    int holders = 1;
    if (head == popped)
      ++holders;
    if (tail == popped)
      ++holders;
    if (formerSuccessor != NIL && arena.prev(formerSuccessor) == popped)
      ++holders;

    if (holders != 1) {
      String msg =
          "popped node [%d] still has %d holders (expected 1): head %d, tail %d, successor %d"
          .formatted(popped, holders, head, tail, formerSuccessor);
      TlogConstants.logError(msg);
      throw new DanglingLinkError(msg);
    }
    return arena.release(popped);
  }



  /**
   * Returns the number of entries.
   */
  public long length() {
    return length;
  }


  public boolean isEmpty() {
    return length == 0;
  }


  /**
   * Returns the first node, if any.
   */
  public Optional<Node> head() {
    return handle(head);
  }


  /**
   * Returns the last node, if any.
   */
  public Optional<Node> tail() {
    return handle(tail);
  }


  /**
   * Returns the value at the head without removing it.
   */
  public Optional<String> peekFirst() {
    return head == NIL ? Optional.empty() : Optional.of(arena.value(head));
  }


  /**
   * Returns the value at the tail without removing it.
   */
  public Optional<String> peekLast() {
    return tail == NIL ? Optional.empty() : Optional.of(arena.value(tail));
  }



  /**
   * Returns a head-to-tail cursor.
   *
   * @see #cursor()
   */
  @Override
  public LogCursor iterator() {
    return cursor();
  }


  /**
   * Returns a head-to-tail cursor.
   */
  public LogCursor cursor() {
    return LogCursor.forward(head().orElse(null));
  }


  /**
   * Returns a tail-to-head cursor.
   */
  public LogCursor descendingCursor() {
    return LogCursor.backward(tail().orElse(null));
  }


  /**
   * Returns the values, head first, as a read-only snapshot.
   */
  public List<String> toList() {
    var values = new ArrayList<String>((int) Math.min(length, Integer.MAX_VALUE));
    for (int node = head; node != NIL; node = arena.next(node))
      values.add(arena.value(node));
    return Collections.unmodifiableList(values);
  }


  /**
   * Returns an independent copy of this log, with the same entries in
   * the same order.
   */
  public TransactionLog copy() {
    var copy = new TransactionLog(Math.max(arena.liveCount(), TlogConstants.DEFAULT_CAPACITY));
    for (int node = head; node != NIL; node = arena.next(node))
      copy.append(arena.value(node));
    return copy;
  }


  /**
   * Removes every entry, one node at a time, head first.
   *
   * @return the number of entries removed
   */
  public long clear() {
    long count = 0;
    while (pop().isPresent())
      ++count;
    if (count != 0)
      TlogConstants.logDebug("cleared " + count + " entries");
    return count;
  }



  /**
   * Walks the log in both directions and checks that adjacent nodes link to
   * one another reciprocally, and that both walks take exactly
   * {@linkplain #length()} steps.
   *
   * @throws DanglingLinkError on the first inconsistency found
   */
  public void verifyLinks() throws DanglingLinkError {
    if (head == NIL || tail == NIL) {
      if (head != tail || length != 0)
        brokenLink("head %d, tail %d, length %d".formatted(head, tail, length));
      if (arena.liveCount() != 0)
        brokenLink("empty log with " + arena.liveCount() + " live nodes");
      return;
    }
    if (arena.prev(head) != NIL)
      brokenLink("head [" + head + "] links back to " + arena.prev(head));
    if (arena.next(tail) != NIL)
      brokenLink("tail [" + tail + "] links forward to " + arena.next(tail));

    long steps = 1;
    for (int node = head; node != tail; ++steps) {
      int successor = arena.next(node);
      if (successor == NIL)
        brokenLink("forward walk ends at [" + node + "] before reaching tail");
      if (arena.prev(successor) != node)
        brokenLink(
            "[%d].next is [%d] but [%d].prev is %d"
            .formatted(node, successor, successor, arena.prev(successor)));
      if (steps == length)
        brokenLink("forward walk exceeds length " + length);
      node = successor;
    }
    if (steps != length)
      brokenLink("forward walk took " + steps + " steps; length is " + length);

    steps = 1;
    for (int node = tail; node != head; ++steps) {
      int predecessor = arena.prev(node);
      if (predecessor == NIL)
        brokenLink("backward walk ends at [" + node + "] before reaching head");
      if (steps == length)
        brokenLink("backward walk exceeds length " + length);
      node = predecessor;
    }
    if (steps != length)
      brokenLink("backward walk took " + steps + " steps; length is " + length);

    if (arena.liveCount() != length)
      brokenLink(arena.liveCount() + " live nodes; length is " + length);
  }


  private void brokenLink(String msg) {
    throw new DanglingLinkError(msg);
  }


  private Optional<Node> handle(int slot) {
    return slot == NIL ? Optional.empty() : Optional.of(new Node(arena, slot));
  }


  /**
   * Package-private, for tests.
   */
  NodeArena arena() {
    return arena;
  }



  /**
   * Two logs are equal if they hold equal values in the same order.
   */
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof TransactionLog))
      return false;
    TransactionLog other = (TransactionLog) o;
    if (other.length != length)
      return false;
    int a = head;
    int b = other.head;
    for (; a != NIL; a = arena.next(a), b = other.arena.next(b)) {
      if (!arena.value(a).equals(other.arena.value(b)))
        return false;
    }
    return true;
  }


  /**
   * Consistent with {@linkplain #equals(Object)}; computed the way
   * {@linkplain List#hashCode()} is.
   */
  @Override
  public int hashCode() {
    int hash = 1;
    for (int node = head; node != NIL; node = arena.next(node))
      hash = 31 * hash + arena.value(node).hashCode();
    return hash;
  }


  /**
   * Shallow: shows the length and the two end nodes only.
   *
   * @see Node#toString()
   */
  @Override
  public String toString() {
    return "TransactionLog[length=" + length +
        ", head=" + head().map(Node::toString).orElse("none") +
        ", tail=" + tail().map(Node::toString).orElse("none") + "]";
  }

}
