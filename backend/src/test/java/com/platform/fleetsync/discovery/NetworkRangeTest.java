package com.platform.fleetsync.discovery;

import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkRangeTest {

    @Test
    void parse_cidr_excludesNetworkAndBroadcast() {
        NetworkRange range = NetworkRange.parse("192.168.1.0/24", 1024);

        assertThat(range.size()).isEqualTo(254);
        assertThat(range.addresses()).startsWith("192.168.1.1").endsWith("192.168.1.254");
    }

    @Test
    void parse_cidrWithHostBits_normalizesToNetwork() {
        assertThat(NetworkRange.parse("10.0.0.77/30", 16).addresses()).containsExactly("10.0.0.77", "10.0.0.78");
    }

    @Test
    void parse_slash32_isSingleHost() {
        assertThat(NetworkRange.parse("10.0.0.5/32", 16).addresses()).containsExactly("10.0.0.5");
    }

    @Test
    void parse_shortDashRange_reusesPrefix() {
        assertThat(NetworkRange.parse("192.168.1.10-12", 16).addresses())
            .containsExactly("192.168.1.10", "192.168.1.11", "192.168.1.12");
    }

    @Test
    void parse_fullDashRange_crossesOctets() {
        NetworkRange range = NetworkRange.parse("10.0.0.254-10.0.1.1", 16);

        assertThat(range.addresses()).containsExactly("10.0.0.254", "10.0.0.255", "10.0.1.0", "10.0.1.1");
    }

    @Test
    void parse_singleAddress() {
        assertThat(NetworkRange.parse(" 172.16.0.9 ", 1).addresses()).containsExactly("172.16.0.9");
    }

    @Test
    void parse_rangeLargerThanLimit_isRejected() {
        assertThatThrownBy(() -> NetworkRange.parse("10.0.0.0/16", 1024))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("limit of 1024")
            .extracting(e -> ((ValidationException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_NETWORK_RANGE);
    }

    @Test
    void parse_malformedInput_isRejected() {
        assertThatThrownBy(() -> NetworkRange.parse("10.0.0.300", 16)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> NetworkRange.parse("10.0.0.0/33", 16)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> NetworkRange.parse("10.0.0.9-3", 16)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> NetworkRange.parse("", 16)).isInstanceOf(ValidationException.class);
    }
}
