package org.lite.toolgateway.validation;

import io.netty.resolver.AddressResolver;
import io.netty.resolver.AddressResolverGroup;
import io.netty.resolver.InetNameResolver;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Promise;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;

/**
 * Name resolution used by the outbound connector client. The addresses a
 * connection is about to use are checked against the restricted ranges, so a
 * host that rebinds between the SSRF check and the connect still cannot reach
 * an internal address.
 */
@Slf4j
public class GuardedAddressResolverGroup extends AddressResolverGroup<InetSocketAddress> {

    private final HostResolver hostResolver;

    public GuardedAddressResolverGroup(HostResolver hostResolver) {
        this.hostResolver = hostResolver;
    }

    @Override
    protected AddressResolver<InetSocketAddress> newResolver(EventExecutor executor) {
        return new GuardedNameResolver(executor, hostResolver).asAddressResolver();
    }

    /**
     * Raised when a host resolves to at least one restricted address at connect time.
     */
    public static final class RestrictedAddressException extends UnknownHostException {
        public RestrictedAddressException(String host) {
            super("Host " + host + " resolves to a restricted address");
        }
    }

    private static final class GuardedNameResolver extends InetNameResolver {

        private final HostResolver hostResolver;

        private GuardedNameResolver(EventExecutor executor, HostResolver hostResolver) {
            super(executor);
            this.hostResolver = hostResolver;
        }

        @Override
        protected void doResolve(String inetHost, Promise<InetAddress> promise) {
            try {
                promise.setSuccess(checkedAddresses(inetHost).get(0));
            } catch (UnknownHostException e) {
                promise.setFailure(e);
            }
        }

        @Override
        protected void doResolveAll(String inetHost, Promise<List<InetAddress>> promise) {
            try {
                promise.setSuccess(checkedAddresses(inetHost));
            } catch (UnknownHostException e) {
                promise.setFailure(e);
            }
        }

        private List<InetAddress> checkedAddresses(String host) throws UnknownHostException {
            InetAddress[] addresses = hostResolver.resolveAll(host);
            if (addresses == null || addresses.length == 0) {
                throw new UnknownHostException(host);
            }
            for (InetAddress address : addresses) {
                if (RestrictedAddresses.isRestricted(address)) {
                    log.warn("Blocked outbound connection to {}: resolved to a restricted address", host);
                    throw new RestrictedAddressException(host);
                }
            }
            return Arrays.asList(addresses);
        }
    }
}
