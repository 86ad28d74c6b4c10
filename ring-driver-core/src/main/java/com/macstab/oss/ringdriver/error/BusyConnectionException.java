/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.error;

import java.net.InetSocketAddress;

/** All stream ids of a transport are in use. The request was never written. */
public class BusyConnectionException extends ConnectionException {

  private static final long serialVersionUID = 1L;

  public BusyConnectionException(final InetSocketAddress address, final int inFlight) {
    super(address, "no free stream id (" + inFlight + " requests in flight)", null, false);
  }
}
