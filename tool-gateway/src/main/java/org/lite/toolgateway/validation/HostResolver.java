package org.lite.toolgateway.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Blocking name resolution returning every address record of a host.
 */
@FunctionalInterface
public interface HostResolver {

    InetAddress[] resolveAll(String host) throws UnknownHostException;

    static HostResolver system() {
        return InetAddress::getAllByName;
    }
}
