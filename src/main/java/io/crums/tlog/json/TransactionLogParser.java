/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog.json;


import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import io.crums.tlog.TransactionLog;

/**
 * {@linkplain TransactionLog} JSON parser. The format is
 * <pre>
 *   {
 *     "length": 3,
 *     "entries": [ "first", "second", "third" ]
 *   }
 * </pre>
 * with entries listed head first. On input, {@code "length"} is optional;
 * if present it must agree with the number of entries.
 */
public class TransactionLogParser {

  public final static String LENGTH = "length";
  public final static String ENTRIES = "entries";


  /**
   * Singleton stateless instance.
   */
  public final static TransactionLogParser INSTANCE = new TransactionLogParser();


  protected TransactionLogParser() {  }



  /**
   * Returns the given {@code log} as JSON.
   *
   * @return {@code injectEntity(log, new JSONObject())}
   */
  public JSONObject toJsonObject(TransactionLog log) {
    return injectEntity(log, new JSONObject());
  }


  /**
   * Returns the given {@code log} as a JSON string.
   */
  public String toJson(TransactionLog log) {
    return toJsonObject(log).toJSONString();
  }


  /**
   * Injects the given {@code log}'s length and entries into the given
   * {@code jObj}. The log is not modified.
   *
   * @return {@code jObj}
   */
  @SuppressWarnings("unchecked")
  public JSONObject injectEntity(TransactionLog log, JSONObject jObj) {
    JSONArray jEntries = new JSONArray();
    for (String entry : log)
      jEntries.add(entry);
    jObj.put(LENGTH, log.length());
    jObj.put(ENTRIES, jEntries);
    return jObj;
  }



  /**
   * Returns a new log holding the entries in the given JSON.
   *
   * @throws JsonParsingException if the entries are missing, not all strings,
   *         or disagree with the stated length
   */
  public TransactionLog toEntity(JSONObject jObj) throws JsonParsingException {
    JSONArray jEntries = getJsonArray(jObj, ENTRIES);
    Number length = getNumber(jObj, LENGTH);
    if (length != null && !(length instanceof Long || length instanceof Integer))
      throw new JsonParsingException("'" + LENGTH + "' expects an integer: " + length);
    if (length != null && length.longValue() != jEntries.size())
      throw new JsonParsingException(
          "'" + LENGTH + "' " + length + " != " + jEntries.size() + " entries");

    var log = new TransactionLog(jEntries.size());
    for (int index = 0; index < jEntries.size(); ++index) {
      Object entry = jEntries.get(index);
      if (!(entry instanceof String))
        throw new JsonParsingException(
            "'" + ENTRIES + "'[" + index + "] expects a simple string: " + entry);
      log.append((String) entry);
    }
    return log;
  }


  /**
   * Parses the given JSON text and returns it as a new log.
   *
   * @throws JsonParsingException if the text is malformed, is not a single
   *         JSON object, or breaks the grammar
   */
  public TransactionLog toEntity(String json) throws JsonParsingException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    }
    if (!(parsed instanceof JSONObject))
      throw new JsonParsingException(
          "expected a JSON object: " + json.substring(0, Math.min(20, json.length())) + "...");
    return toEntity((JSONObject) parsed);
  }



  private static JSONArray getJsonArray(JSONObject jObj, String name) {
    Object value = jObj.get(name);
    if (value == null)
      throw new JsonParsingException("expected JSON array '" + name + "' missing");
    if (!(value instanceof JSONArray))
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value);
    return (JSONArray) value;
  }


  private static Number getNumber(JSONObject jObj, String name) {
    Object value = jObj.get(name);
    if (value == null)
      return null;
    if (!(value instanceof Number))
      throw new JsonParsingException("'" + name + "' expects a numeral: " + value);
    return (Number) value;
  }

}
