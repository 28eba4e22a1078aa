package com.questrail.amqp.transport.connect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet6Address;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.function.BooleanSupplier;

/**
 * Detects whether this JVM can open IPv6 connections at all.
 */
public final class Ipv6Support
{
    private static final Logger log = LoggerFactory.getLogger(Ipv6Support.class);

    private Ipv6Support() {}

    /**
     * IPv6 is considered available unless the JVM was started with
     * {@code java.net.preferIPv4Stack=true} or no interface carries an IPv6
     * address. The check runs on every call.
     */
    public static BooleanSupplier platformDefault()
    {
        return Ipv6Support::detect;
    }

    static boolean detect()
    {
        if (Boolean.getBoolean("java.net.preferIPv4Stack")) {
            return false;
        }
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return false;
            }
            for (NetworkInterface nif : Collections.list(interfaces)) {
                if (nif.inetAddresses().anyMatch(a -> a instanceof Inet6Address)) {
                    return true;
                }
            }
            return false;
        }
        catch (SocketException e) {
            log.debug("Unable to enumerate network interfaces; assuming no IPv6", e);
            return false;
        }
    }
}
