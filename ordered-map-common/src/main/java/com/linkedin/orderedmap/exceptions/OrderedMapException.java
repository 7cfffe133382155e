package com.linkedin.orderedmap.exceptions;

/**
 * Base exception that all other ordered map exceptions extend. The container itself never throws it from
 * lookups or mutations; it signals misuse of the surrounding factory and configuration layer.
 */
public class OrderedMapException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public OrderedMapException(String s) {
    super(s);
  }

  public OrderedMapException(String s, Throwable t) {
    super(s, t);
  }
}
