/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.policy;

/** How a policy ranks a host: preferred, overflow, or never used. */
public enum HostDistance {
  LOCAL,
  REMOTE,
  IGNORED
}
