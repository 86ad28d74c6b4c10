/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.protocol;

/** Body of a frame, request or response. */
public interface Message {

  Opcode opcode();
}
