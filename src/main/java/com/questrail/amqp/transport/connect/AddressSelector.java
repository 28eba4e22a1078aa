package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;

import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the address to dial for a given family out of a resolution result.
 */
public final class AddressSelector
{
    private AddressSelector() {}

    /**
     * @return the first address in {@code addresses} that belongs to
     *         {@code family}, in resolver order
     */
    public static Optional<InetAddress> firstMatching(InetAddress[] addresses, AddressFamily family)
    {
        Objects.requireNonNull(family, "family");
        if (addresses == null) {
            return Optional.empty();
        }
        for (InetAddress address : addresses) {
            if (address != null && family.matches(address)) {
                return Optional.of(address);
            }
        }
        return Optional.empty();
    }
}
