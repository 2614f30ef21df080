/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.model;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * IPv4 or IPv6 network in CIDR notation
 */
public final class Cidr {
    private static final Pattern ADDRESS_LITERAL = Pattern.compile("[0-9a-fA-F.:]+");

    private final String value;
    private final int bits;
    private final int prefixLength;
    private final BigInteger network;

    private Cidr(String value, int bits, int prefixLength, BigInteger network) {
        this.value = value;
        this.bits = bits;
        this.prefixLength = prefixLength;
        this.network = network;
    }

    /**
     * Parses a CIDR such as 10.0.0.0/24 or fd00::/64. Host bits are ignored.
     *
     * @param cidr  CIDR string
     *
     * @return  Parsed CIDR
     *
     * @throws IllegalArgumentException When the string is not a valid CIDR
     */
    public static Cidr parse(String cidr) {
        if (cidr == null) {
            throw new IllegalArgumentException("CIDR must not be null");
        }

        int slash = cidr.indexOf('/');
        if (slash <= 0 || slash == cidr.length() - 1) {
            throw new IllegalArgumentException("Invalid CIDR " + cidr);
        }

        String address = cidr.substring(0, slash);
        // Only IP literals are accepted so that parsing never triggers a DNS lookup
        if (!ADDRESS_LITERAL.matcher(address).matches()) {
            throw new IllegalArgumentException("Invalid CIDR address " + cidr);
        }

        byte[] bytes;
        try {
            bytes = InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid CIDR address " + cidr, e);
        }

        int bits = bytes.length * 8;
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid CIDR prefix length " + cidr, e);
        }

        if (prefixLength < 0 || prefixLength > bits) {
            throw new IllegalArgumentException("Invalid CIDR prefix length " + cidr);
        }

        return new Cidr(cidr, bits, prefixLength, prefix(new BigInteger(1, bytes), bits, prefixLength));
    }

    /**
     * @param other     Another CIDR
     *
     * @return  True when both networks share at least one address. Networks of different IP families never overlap.
     */
    public boolean overlaps(Cidr other) {
        if (bits != other.bits) {
            return false;
        }

        int shorter = Math.min(prefixLength, other.prefixLength);
        return prefix(network, bits, shorter).equals(prefix(other.network, bits, shorter));
    }

    /**
     * @return  True for IPv6 networks
     */
    public boolean isIpv6() {
        return bits == 128;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    private static BigInteger prefix(BigInteger address, int bits, int prefixLength) {
        return address.shiftRight(bits - prefixLength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof Cidr)) {
            return false;
        }

        Cidr cidr = (Cidr) o;
        return bits == cidr.bits && prefixLength == cidr.prefixLength && network.equals(cidr.network);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * bits + prefixLength) + network.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
