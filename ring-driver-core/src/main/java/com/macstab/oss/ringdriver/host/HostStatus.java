/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.host;

/** Liveness of a node as last reported by events, pools or the downed-host reconnector. */
public enum HostStatus {
  UP,
  DOWN
}
