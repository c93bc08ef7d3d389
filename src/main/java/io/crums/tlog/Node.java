/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import static io.crums.tlog.TlogConstants.NIL;

import java.util.Optional;

/**
 * Handle to a node in a {@linkplain TransactionLog}. Instances are immutable
 * and cheap; they do not keep the node alive. Once the node is popped from
 * its log, the handle goes stale and its accessors throw
 * {@code IllegalStateException}.
 *
 * @see #isLive()
 */
public final class Node {

  private final NodeArena arena;
  private final int slot;
  private final int stamp;


  Node(NodeArena arena, int slot) {
    this.arena = arena;
    this.slot = slot;
    this.stamp = arena.stamp(slot);
  }


  /**
   * Returns {@code false} if the node this handle refers to has since been
   * popped from its log.
   */
  public boolean isLive() {
    return arena.isLive(slot, stamp);
  }


  /**
   * Returns the entry value.
   *
   * @throws IllegalStateException if the node is no longer live
   */
  public String value() {
    checkLive();
    return arena.value(slot);
  }


  /**
   * Returns the successor, if any.
   *
   * @throws IllegalStateException if the node is no longer live
   */
  public Optional<Node> next() {
    checkLive();
    return handle(arena.next(slot));
  }


  /**
   * Returns the predecessor, if any.
   *
   * @throws IllegalStateException if the node is no longer live
   */
  public Optional<Node> prev() {
    checkLive();
    return handle(arena.prev(slot));
  }


  public boolean hasNext() {
    checkLive();
    return arena.next(slot) != NIL;
  }


  public boolean hasPrev() {
    checkLive();
    return arena.prev(slot) != NIL;
  }


  private Optional<Node> handle(int target) {
    return target == NIL ? Optional.empty() : Optional.of(new Node(arena, target));
  }


  private void checkLive() {
    if (!isLive())
      throw new IllegalStateException("node [" + slot + "] has been released");
  }



  /**
   * Two handles are equal iff they refer to the same node.
   */
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof Node))
      return false;
    Node other = (Node) o;
    return other.arena == arena && other.slot == slot && other.stamp == stamp;
  }


  @Override
  public int hashCode() {
    return slot * 31 + stamp;
  }


  /**
   * Shallow: prints the value and whether the node has neighbors, never
   * the neighbors themselves.
   */
  @Override
  public String toString() {
    if (!isLive())
      return "Node[released]";
    return "Node[value=" + arena.value(slot) +
        ", prev=" + (arena.prev(slot) != NIL) +
        ", next=" + (arena.next(slot) != NIL) + "]";
  }

}
