/*
 * Copyright 2026 Babak Farhang
 */
/**
 * An in-memory, doubly linked transaction log.
 * <p>
 * A {@linkplain io.crums.tlog.TransactionLog} is a FIFO list of string
 * entries: append at the tail, pop from the head, walk either way with a
 * {@linkplain io.crums.tlog.LogCursor}. Nodes are held in an index-addressed
 * arena rather than by reference; {@linkplain io.crums.tlog.Node} handles
 * expose them read-only and go stale once their node is popped.
 * </p>
 */
package io.crums.tlog;
