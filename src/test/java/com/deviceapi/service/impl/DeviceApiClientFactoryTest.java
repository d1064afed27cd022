package com.deviceapi.service.impl;

import com.deviceapi.exception.InvalidArgumentException;
import com.deviceapi.model.BasicCredentials;
import com.deviceapi.model.Connection;
import com.deviceapi.model.DecodePolicy;
import com.deviceapi.service.api.DeviceTransport;
import com.deviceapi.service.api.DeviceTransportFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceApiClientFactoryTest {

    @Mock
    private DeviceTransportFactory transportFactory;

    @Mock
    private DeviceTransport transport;

    private DeviceApiClientFactory clientFactory;

    @BeforeEach
    void setUp() {
        clientFactory = new DeviceApiClientFactory(transportFactory, DeviceApiClient.defaultObjectMapper(), DecodePolicy.STRICT);
    }

    @Test
    void open_shouldReturnIndependentInitializedClients() {
        Connection first = Connection.of("device-a");
        Connection second = Connection.of("device-b");
        BasicCredentials credentials = new BasicCredentials("Administrator", "p@ssw0rd");
        when(transportFactory.create(first, credentials)).thenReturn(transport);
        when(transportFactory.create(second, credentials)).thenReturn(transport);

        DeviceApiClient a = clientFactory.open(first, credentials);
        DeviceApiClient b = clientFactory.open(second, credentials);

        assertThat(a).isNotSameAs(b);
        assertThat(a.isInitialized()).isTrue();
        assertThat(a.getConnection()).isEqualTo(first);
        assertThat(b.getConnection()).isEqualTo(second);
        assertThat(a.getDecodePolicy()).isEqualTo(DecodePolicy.STRICT);
    }

    @Test
    void open_shouldRejectMissingArguments() {
        assertThatThrownBy(() -> clientFactory.open(null, new BasicCredentials("Administrator", "")))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> clientFactory.open(Connection.of("device-a"), null))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void create_shouldReturnUnconfiguredClient() {
        DeviceApiClient client = clientFactory.create();

        assertThat(client.isInitialized()).isFalse();
        assertThat(client.getDecodePolicy()).isEqualTo(DecodePolicy.STRICT);
    }
}
