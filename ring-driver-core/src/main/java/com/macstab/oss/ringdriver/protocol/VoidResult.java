/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** RESULT of kind Void: statements without a result set. */
public enum VoidResult implements ResultMessage {
  INSTANCE
}
