/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON export and import of {@linkplain io.crums.tlog.TransactionLog}
 * entries, using the {@code json.simple} library.
 */
package io.crums.tlog.json;
