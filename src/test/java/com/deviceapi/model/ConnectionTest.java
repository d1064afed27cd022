package com.deviceapi.model;

import com.deviceapi.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    @Test
    void of_shouldUseHttpAndDefaultDevicePortalPort() {
        Connection connection = Connection.of("minwinpc");

        assertThat(connection.scheme()).isEqualTo("http");
        assertThat(connection.port()).isEqualTo(8080);
        assertThat(connection.baseUrl()).isEqualTo("http://minwinpc:8080");
    }

    @Test
    void parse_shouldReadSchemeHostAndPort() {
        Connection connection = Connection.parse("HTTPS://10.0.0.5:8443");

        assertThat(connection).isEqualTo(new Connection("https", "10.0.0.5", 8443));
        assertThat(connection.baseUrl()).isEqualTo("https://10.0.0.5:8443");
    }

    @Test
    void parse_shouldDefaultSchemeAndPortWhenMissing() {
        assertThat(Connection.parse("192.168.1.20")).isEqualTo(new Connection("http", "192.168.1.20", 8080));
        assertThat(Connection.parse("https://device.local")).isEqualTo(new Connection("https", "device.local", 443));
    }

    @Test
    void parse_shouldRejectBlankOrHostlessUrls() {
        assertThatThrownBy(() -> Connection.parse(" ")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> Connection.parse("http://:8080")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> Connection.parse("http://bad host")).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void constructor_shouldRejectUnsupportedSchemeAndPort() {
        assertThatThrownBy(() -> new Connection("ftp", "device", 21))
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("ftp");
        assertThatThrownBy(() -> new Connection("http", "device", 0)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new Connection("http", "device", 70000)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new Connection("http", null, 8080)).isInstanceOf(InvalidArgumentException.class);
    }
}
