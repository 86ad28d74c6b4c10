/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.ringdriver.control;

import java.net.InetSocketAddress;

/**
 * Maps the address a node advertises to the address the driver must connect to.
 *
 * <p>Applied to every peer discovered through the system tables and to the addresses carried by
 * push events. Needed when nodes sit behind NAT or in a container network that clients cannot
 * reach directly.
 */
@FunctionalInterface
public interface AddressTranslator {

  AddressTranslator IDENTITY = address -> address;

  InetSocketAddress translate(InetSocketAddress advertised);
}
