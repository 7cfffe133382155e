package com.linkedin.orderedmap.exceptions;

/**
 * Thrown when a config property is invalid or missing
 */
public class ConfigurationException extends OrderedMapException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
