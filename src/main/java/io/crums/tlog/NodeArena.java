/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import static io.crums.tlog.TlogConstants.NIL;

import java.util.Arrays;
import java.util.Objects;

/**
 * Backing store for the nodes of a single {@linkplain TransactionLog}. Nodes
 * are addressed by slot index; links are indices, not references, so the
 * arena is the only owner of every node.
 *
 * <h3>Stamps</h3>
 * <p>
 * Each slot carries a stamp that is bumped on every allocation and every
 * release: an odd stamp means the slot is live, an even one that it's free.
 * A {@linkplain Node} handle records the stamp it was minted with, so a
 * handle to a released (and possibly reused) slot is detectably stale.
 * </p>
 * <h3>Free list</h3>
 * <p>
 * Released slots are threaded through the {@code next} column and handed
 * out again before the frontier advances.
 * </p>
 */
final class NodeArena {

  /**
   * Largest number of slots an arena will hold.
   */
  final static int MAX_SLOTS = Integer.MAX_VALUE - 8;

  private String[] values;
  private int[] next;
  private int[] prev;
  private int[] stamps;

  /** Number of slots ever claimed. Slots at and beyond are virgin. */
  private int frontier;
  private int freeHead = NIL;
  private int liveCount;


  NodeArena(int initCapacity) {
    if (initCapacity < 0)
      throw new IllegalArgumentException("negative capacity: " + initCapacity);
    values = new String[initCapacity];
    next = new int[initCapacity];
    prev = new int[initCapacity];
    stamps = new int[initCapacity];
  }


  /**
   * Allocates a new, unlinked node holding the given value.
   *
   * @return the node's slot
   */
  int allocate(String value) {
    Objects.requireNonNull(value, "null value");
    int slot;
    if (freeHead != NIL) {
      slot = freeHead;
      freeHead = next[slot];
    } else {
      if (frontier == values.length)
        grow();
      slot = frontier++;
    }
    values[slot] = value;
    next[slot] = NIL;
    prev[slot] = NIL;
    ++stamps[slot];
    ++liveCount;
    return slot;
  }


  /**
   * Releases the node at the given slot and returns its value. The node
   * must already be unlinked (both its links {@code NIL}); the caller is
   * responsible for having dropped every incoming link.
   *
   * @throws DanglingLinkError if the slot is not live, or still links out
   */
  String release(int slot) {
    checkLive(slot);
    if (next[slot] != NIL || prev[slot] != NIL)
      throw new DanglingLinkError(
          "release of still-linked slot [%d]: prev %d, next %d"
          .formatted(slot, prev[slot], next[slot]));
    String value = values[slot];
    values[slot] = null;
    ++stamps[slot];
    next[slot] = freeHead;
    freeHead = slot;
    --liveCount;
    return value;
  }


  String value(int slot) {
    return values[slot];
  }

  int next(int slot) {
    return next[slot];
  }

  int prev(int slot) {
    return prev[slot];
  }

  void setNext(int slot, int target) {
    next[slot] = target;
  }

  void setPrev(int slot, int target) {
    prev[slot] = target;
  }


  int stamp(int slot) {
    return stamps[slot];
  }


  boolean isLive(int slot, int stamp) {
    return slot >= 0 && slot < frontier && stamps[slot] == stamp && (stamp & 1) == 1;
  }


  int liveCount() {
    return liveCount;
  }


  int capacity() {
    return values.length;
  }



  private void checkLive(int slot) {
    if (slot < 0 || slot >= frontier || (stamps[slot] & 1) == 0)
      throw new DanglingLinkError("slot [" + slot + "] is not live");
  }


  /**
   * Returns the capacity to grow to from the given one: double, but no
   * less than {@linkplain TlogConstants#DEFAULT_CAPACITY} and no more than
   * {@linkplain #MAX_SLOTS}.
   *
   * @throws IllegalStateException if {@code oldCap} is already at the maximum
   */
  static int nextCapacity(int oldCap) {
    if (oldCap >= MAX_SLOTS)
      throw new IllegalStateException("node arena full: " + oldCap + " slots");
    long doubled = 2L * oldCap;
    return (int) Math.min(MAX_SLOTS, Math.max(TlogConstants.DEFAULT_CAPACITY, doubled));
  }


  private void grow() {
    int oldCap = values.length;
    int newCap = nextCapacity(oldCap);
    values = Arrays.copyOf(values, newCap);
    next = Arrays.copyOf(next, newCap);
    prev = Arrays.copyOf(prev, newCap);
    stamps = Arrays.copyOf(stamps, newCap);
    TlogConstants.logDebug("node arena grown from " + oldCap + " to " + newCap + " slots");
  }

}
