/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.model;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CidrTest {
    @Test
    public void testOverlappingIpv4Networks() {
        assertThat(Cidr.parse("10.0.0.0/16").overlaps(Cidr.parse("10.0.1.0/24")), is(true));
        assertThat(Cidr.parse("10.0.1.0/24").overlaps(Cidr.parse("10.0.0.0/16")), is(true));
        assertThat(Cidr.parse("10.0.0.0/24").overlaps(Cidr.parse("10.0.0.0/24")), is(true));
    }

    @Test
    public void testDisjointIpv4Networks() {
        assertThat(Cidr.parse("10.0.0.0/24").overlaps(Cidr.parse("10.0.1.0/24")), is(false));
        assertThat(Cidr.parse("192.168.0.0/16").overlaps(Cidr.parse("10.0.0.0/8")), is(false));
    }

    @Test
    public void testHostBitsAreIgnored() {
        assertThat(Cidr.parse("10.0.0.17/24"), is(Cidr.parse("10.0.0.0/24")));
        assertThat(Cidr.parse("10.0.0.17/24").toString(), is("10.0.0.17/24"));
    }

    @Test
    public void testIpv6Networks() {
        Cidr cidr = Cidr.parse("fd00:10::/64");

        assertThat(cidr.isIpv6(), is(true));
        assertThat(cidr.getPrefixLength(), is(64));
        assertThat(cidr.overlaps(Cidr.parse("fd00:10::/48")), is(true));
        assertThat(cidr.overlaps(Cidr.parse("fd00:11::/64")), is(false));
    }

    @Test
    public void testDifferentFamiliesNeverOverlap() {
        assertThat(Cidr.parse("0.0.0.0/0").overlaps(Cidr.parse("::/0")), is(false));
    }

    @Test
    public void testInvalidCidrs() {
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0"));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/"));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("10.0.0.0/abc"));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("example.com/24"));
        assertThrows(IllegalArgumentException.class, () -> Cidr.parse("fd00::/129"));
    }
}
