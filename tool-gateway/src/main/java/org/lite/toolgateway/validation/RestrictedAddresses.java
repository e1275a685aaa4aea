package org.lite.toolgateway.validation;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Byte-level classification of addresses an outbound tool call must never reach:
 * loopback, unspecified, private, shared (CGNAT), link-local, documentation,
 * benchmarking, multicast and reserved ranges, for IPv4 and IPv6, including
 * IPv4 addresses embedded in IPv6 forms (mapped, compatible, NAT64, 6to4).
 */
public final class RestrictedAddresses {

    private RestrictedAddresses() {
    }

    public static boolean isRestricted(InetAddress address) {
        if (address == null) {
            return true;
        }
        if (address.isAnyLocalAddress()
                || address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet4Address) {
            return isRestrictedIpv4(raw);
        }
        if (address instanceof Inet6Address) {
            return isRestrictedIpv6(raw);
        }
        return true;
    }

    static boolean isRestrictedIpv4(byte[] raw) {
        int a = raw[0] & 0xFF;
        int b = raw[1] & 0xFF;
        int c = raw[2] & 0xFF;

        return a == 0                                   // 0.0.0.0/8 "this network"
                || a == 10                              // 10/8
                || (a == 100 && (b & 0xC0) == 64)       // 100.64/10 shared address space
                || a == 127                             // loopback
                || (a == 169 && b == 254)               // link-local
                || (a == 172 && (b & 0xF0) == 16)       // 172.16/12
                || (a == 192 && b == 0 && c == 0)       // 192.0.0/24 IETF protocol assignments
                || (a == 192 && b == 0 && c == 2)       // TEST-NET-1
                || (a == 192 && b == 88 && c == 99)     // 6to4 relay anycast
                || (a == 192 && b == 168)               // 192.168/16
                || (a == 198 && (b & 0xFE) == 18)       // 198.18/15 benchmarking
                || (a == 198 && b == 51 && c == 100)    // TEST-NET-2
                || (a == 203 && b == 0 && c == 113)     // TEST-NET-3
                || a >= 224;                            // multicast, 240/4 reserved, broadcast
    }

    static boolean isRestrictedIpv6(byte[] raw) {
        int first = raw[0] & 0xFF;
        int second = raw[1] & 0xFF;

        if (first == 0xFF) {
            return true;                                // multicast
        }
        if ((first & 0xFE) == 0xFC) {
            return true;                                // fc00::/7 unique local
        }
        if (first == 0xFE && (second & 0xC0) == 0x80) {
            return true;                                // fe80::/10 link-local
        }
        if (first == 0xFE && (second & 0xC0) == 0xC0) {
            return true;                                // fec0::/10 site-local (deprecated)
        }
        if (first == 0x20 && second == 0x01) {
            int third = raw[2] & 0xFF;
            int fourth = raw[3] & 0xFF;
            if (third == 0x0D && fourth == 0xB8) {
                return true;                            // 2001:db8::/32 documentation
            }
            if (third == 0x00 && fourth == 0x00) {
                return true;                            // 2001::/32 Teredo
            }
        }
        if (first == 0x20 && second == 0x02) {
            return isRestrictedIpv4(new byte[]{raw[2], raw[3], raw[4], raw[5]}); // 6to4
        }
        if (startsWith(raw, 0x00, 0x64, 0xFF, 0x9B) && allZero(raw, 4, 12)) {
            return isRestrictedIpv4(tail(raw));         // 64:ff9b::/96 NAT64
        }
        if (first == 0x01 && second == 0x00 && allZero(raw, 2, 8)) {
            return true;                                // 100::/64 discard-only
        }
        if (allZero(raw, 0, 10)) {
            int tenth = raw[10] & 0xFF;
            int eleventh = raw[11] & 0xFF;
            if (tenth == 0xFF && eleventh == 0xFF) {
                return isRestrictedIpv4(tail(raw));     // ::ffff:a.b.c.d mapped
            }
            if (tenth == 0 && eleventh == 0) {
                return true;                            // ::, ::1 and ::a.b.c.d compatible
            }
        }
        return false;
    }

    private static boolean startsWith(byte[] raw, int... prefix) {
        for (int i = 0; i < prefix.length; i++) {
            if ((raw[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean allZero(byte[] raw, int from, int to) {
        for (int i = from; i < to; i++) {
            if (raw[i] != 0) {
                return false;
            }
        }
        return true;
    }

    private static byte[] tail(byte[] raw) {
        return new byte[]{raw[12], raw[13], raw[14], raw[15]};
    }
}
