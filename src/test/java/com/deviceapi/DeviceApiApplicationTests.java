package com.deviceapi;

import com.deviceapi.dto.response.MachineName;
import com.deviceapi.model.BasicCredentials;
import com.deviceapi.model.Connection;
import com.deviceapi.model.DecodePolicy;
import com.deviceapi.service.api.DeviceApi;
import com.deviceapi.service.impl.DeviceApiClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "device.api.url=http://minwinpc:8080",
        "device.api.username=Administrator",
        "device.api.password=p@ssw0rd",
        "device.api.decode-policy=STRICT"
})
@ActiveProfiles("test")
class DeviceApiApplicationTests {

    @Autowired
    private DeviceApi deviceApi;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads_withConfiguredDeviceClient() {
        assertThat(deviceApi).isInstanceOf(DeviceApiClient.class);
        assertThat(deviceApi.getConnection()).isEqualTo(new Connection("http", "minwinpc", 8080));
        assertThat(deviceApi.getCredentials()).isEqualTo(new BasicCredentials("Administrator", "p@ssw0rd"));
        assertThat(((DeviceApiClient) deviceApi).getDecodePolicy()).isEqualTo(DecodePolicy.STRICT);
    }

    @Test
    void sharedObjectMapper_shouldRejectTrailingContentAndIgnoreCase() throws Exception {
        assertThat(objectMapper.readValue("{\"computername\":\"minwinpc\"}", MachineName.class).getName())
                .isEqualTo("minwinpc");
        assertThatThrownBy(() -> objectMapper.readValue("{\"ComputerName\":\"minwinpc\"} trailing", MachineName.class))
                .isInstanceOf(JsonProcessingException.class);
        assertThatThrownBy(() -> objectMapper.readValue("\"just a string\"", MachineName.class))
                .isInstanceOf(JsonProcessingException.class);
    }
}
