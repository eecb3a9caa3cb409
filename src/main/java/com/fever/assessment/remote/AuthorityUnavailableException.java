package com.fever.assessment.remote;

/**
 * The remote dialogue backend could not be reached or answered with a non-success status.
 */
public class AuthorityUnavailableException extends RuntimeException {

  public AuthorityUnavailableException(String message) {
    super(message);
  }

  public AuthorityUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
