package com.slack.distributor.errors;

/** Thrown when the calling context carries no tenant id. */
public class MissingTenantException extends RuntimeException {
  public MissingTenantException(String msg) {
    super(msg);
  }
}
