/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class TransactionLogTest {


  @Test
  public void testEmpty() {
    var log = new TransactionLog();
    assertTrue(log.head().isEmpty());
    assertTrue(log.tail().isEmpty());
    assertEquals(0, log.length());
    assertTrue(log.isEmpty());

    assertEquals(Optional.empty(), log.pop());
    assertEquals(0, log.length());
    assertTrue(log.peekFirst().isEmpty());
    assertTrue(log.peekLast().isEmpty());
    assertFalse(log.iterator().hasNext());
    assertFalse(log.descendingCursor().hasNext());
    log.verifyLinks();
  }


  @Test
  public void testAppending() {
    var log = new TransactionLog();

    log.append("Testing1");
    assertEquals(1, log.length());
    Node head = log.head().get();
    assertEquals(head, log.tail().get());
    assertEquals("Testing1", head.value());
    assertFalse(head.hasNext());
    assertFalse(head.hasPrev());

    log.append("Testing2");
    assertEquals(2, log.length());
    assertTrue(log.head().get().hasNext());
    assertEquals("Testing2", log.tail().get().value());
    assertEquals("Testing1", log.head().get().value());

    log.append("Testing3");
    assertEquals(3, log.length());
    assertTrue(log.head().get().next().get().hasNext());
    assertEquals("Testing3", log.tail().get().value());
    assertEquals("Testing1", log.head().get().value());
    log.verifyLinks();
  }


  @Test
  public void testAppendMonotonicity() {
    var log = new TransactionLog(0);
    final int count = 100;
    for (int index = 0; index < count; ++index) {
      log.append("v" + index);
      assertEquals(index + 1, log.length());
      assertEquals("v" + index, log.peekLast().get());
      assertEquals("v0", log.peekFirst().get());
    }
    log.verifyLinks();
  }


  @Test
  public void testPopping() {
    var log = new TransactionLog();
    log.append("Testing1");
    log.append("Testing2");
    log.append("Testing3");

    assertEquals(Optional.of("Testing1"), log.pop());
    assertEquals(2, log.length());
    Node head = log.head().get();
    assertEquals("Testing2", head.value());
    assertTrue(head.hasNext());
    assertEquals("Testing3", head.next().get().value());
    assertEquals(log.tail().get(), head.next().get());
    log.verifyLinks();

    assertEquals(Optional.of("Testing2"), log.pop());
    assertEquals(1, log.length());
    assertEquals(log.head(), log.tail());

    assertEquals(Optional.of("Testing3"), log.pop());
    assertEquals(0, log.length());
    assertTrue(log.head().isEmpty());
    assertTrue(log.tail().isEmpty());

    assertEquals(Optional.empty(), log.pop());
    log.verifyLinks();
  }


  @Test
  public void testPopClearsBackLink() {
    var log = new TransactionLog();
    log.append("a");
    log.append("b");
    log.append("c");

    log.pop();
    Node head = log.head().get();
    assertFalse(head.hasPrev());
    assertTrue(head.prev().isEmpty());
  }


  @Test
  public void testReciprocity() {
    var log = new TransactionLog();
    for (var value : List.of("a", "b", "c", "d", "e"))
      log.append(value);

    Node node = log.head().get();
    while (node.hasNext()) {
      Node successor = node.next().get();
      assertEquals(node, successor.prev().get());
      node = successor;
    }
    assertEquals(log.tail().get(), node);
  }


  @Test
  public void testPopWithoutClearingBackLinkFails() {
    var log = new TransactionLog() {
      @Override
      void clearBackLink(int successor) {  }
    };
    log.append("Testing1");
    log.append("Testing2");

    assertThrows(DanglingLinkError.class, log::pop);
  }


  @Test
  public void testVerifyLinksOneSidedLink() {
    var log = abc();
    log.arena().setPrev(2, TlogConstants.NIL);
    assertThrows(DanglingLinkError.class, log::verifyLinks);

    log.arena().setPrev(2, 1);
    log.verifyLinks();
  }


  @Test
  public void testVerifyLinksChainCutShort() {
    var log = abc();
    log.arena().setNext(1, TlogConstants.NIL);
    assertThrows(DanglingLinkError.class, log::verifyLinks);
  }


  @Test
  public void testVerifyLinksHeadLinksBack() {
    var log = abc();
    log.arena().setPrev(0, 2);
    assertThrows(DanglingLinkError.class, log::verifyLinks);
  }


  @Test
  public void testVerifyLinksTailLinksForward() {
    var log = abc();
    log.arena().setNext(2, 0);
    assertThrows(DanglingLinkError.class, log::verifyLinks);
  }


  @Test
  public void testVerifyLinksOrphanNode() {
    var log = abc();
    log.arena().allocate("orphan");
    assertThrows(DanglingLinkError.class, log::verifyLinks);

    var empty = new TransactionLog();
    empty.arena().allocate("orphan");
    assertThrows(DanglingLinkError.class, empty::verifyLinks);
  }


  /** Returns a log holding a, b, c in slots 0, 1, 2. */
  private static TransactionLog abc() {
    var log = new TransactionLog();
    log.append("a");
    log.append("b");
    log.append("c");
    log.verifyLinks();
    return log;
  }


  @Test
  public void testStaleHandle() {
    var log = new TransactionLog();
    log.append("a");
    log.append("b");
    Node a = log.head().get();
    assertTrue(a.isLive());

    log.pop();
    assertFalse(a.isLive());
    assertThrows(IllegalStateException.class, a::value);
    assertThrows(IllegalStateException.class, a::next);
    assertEquals("Node[released]", a.toString());

    // slot is reused, but the old handle stays stale
    log.append("c");
    assertEquals(2, log.arena().liveCount());
    assertFalse(a.isLive());
    assertNotEquals(a, log.tail().get());
  }


  @Test
  public void testNodeToStringIsShallow() {
    var log = new TransactionLog();
    log.append("first");
    log.append("middle");
    log.append("last");

    Node middle = log.head().get().next().get();
    assertEquals("Node[value=middle, prev=true, next=true]", middle.toString());
    assertEquals("Node[value=first, prev=false, next=true]", log.head().get().toString());
    assertEquals(
        "TransactionLog[length=3, head=Node[value=first, prev=false, next=true], " +
        "tail=Node[value=last, prev=true, next=false]]",
        log.toString());
    assertEquals("TransactionLog[length=0, head=none, tail=none]", new TransactionLog().toString());
  }


  @Test
  public void testDeepClear() {
    final int count = 1_000_000;
    var log = new TransactionLog();
    for (int index = 0; index < count; ++index)
      log.append(Integer.toString(index));
    assertEquals(count, log.length());
    log.verifyLinks();

    assertEquals(count, log.clear());
    assertEquals(0, log.length());
    assertEquals(0, log.arena().liveCount());
    log.verifyLinks();
    assertEquals(0, log.clear());
  }


  @Test
  public void testSlotReuse() {
    var log = new TransactionLog(4);
    for (int round = 0; round < 10; ++round) {
      for (int index = 0; index < 4; ++index)
        log.append(round + ":" + index);
      for (int index = 0; index < 4; ++index)
        assertEquals(Optional.of(round + ":" + index), log.pop());
    }
    assertEquals(4, log.arena().capacity());
    log.verifyLinks();
  }


  @Test
  public void testInterleaved() {
    var log = new TransactionLog(2);
    log.append("a");
    log.append("b");
    assertEquals(Optional.of("a"), log.pop());
    log.append("c");
    log.append("d");
    assertEquals(Optional.of("b"), log.pop());
    log.append("e");
    assertEquals(List.of("c", "d", "e"), log.toList());
    log.verifyLinks();
  }


  @Test
  public void testCopy() {
    var log = new TransactionLog();
    log.append("x");
    log.append("y");

    var copy = log.copy();
    assertEquals(log, copy);
    assertEquals(log.hashCode(), copy.hashCode());
    assertNotEquals(log.head(), copy.head());

    copy.pop();
    assertEquals(2, log.length());
    assertEquals(List.of("x", "y"), log.toList());
    assertEquals(List.of("y"), copy.toList());
    assertNotEquals(log, copy);
  }


  @Test
  public void testEquality() {
    var a = new TransactionLog();
    var b = new TransactionLog(1);
    assertEquals(a, b);
    a.append("one");
    a.append("two");
    b.append("zero");
    b.append("one");
    b.append("two");
    assertNotEquals(a, b);
    b.pop();
    assertEquals(a, b);
    assertEquals(List.of("one", "two").hashCode(), a.hashCode());
  }


  @Test
  public void testAppendNull() {
    var log = new TransactionLog();
    assertThrows(NullPointerException.class, () -> log.append(null));
    assertEquals(0, log.length());
  }


  @Test
  public void testNegativeCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new TransactionLog(-1));
  }

}
