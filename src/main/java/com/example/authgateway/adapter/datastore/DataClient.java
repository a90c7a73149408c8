package com.example.authgateway.adapter.datastore;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table access bound to one credential. Filters are equality matches on column values.
 */
public interface DataClient {

  <T> Optional<T> selectOne(String table, Map<String, String> filters, Class<T> type);

  /**
   * @param order PostgREST order expression such as {@code timestamp.desc}, or null
   * @param limit maximum rows, or 0 for no limit
   */
  <T> List<T> select(String table, Map<String, String> filters, String order, int limit, Class<T> type);

  void insert(String table, Object row);

  DataCredential credential();
}
