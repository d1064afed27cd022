package com.deviceapi.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Response of {@code GET /api/networking/ipconfig}: the device's network adapters and their
 * addresses.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IpConfig {

    @JsonProperty("Adapters")
    private List<Adapter> adapters = new ArrayList<>();

    /**
     * A single network adapter.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Adapter {

        @JsonProperty("Description")
        private String description;

        /**
         * MAC address, formatted by the device as dash-separated hex pairs.
         */
        @JsonProperty("HardwareAddress")
        private String hardwareAddress;

        @JsonProperty("Index")
        private int index;

        /**
         * The adapter GUID, including braces.
         */
        @JsonProperty("Name")
        private String name;

        @JsonProperty("Type")
        private String type;

        @JsonProperty("DHCP")
        private Dhcp dhcp;

        @JsonProperty("Gateways")
        private List<IpAddress> gateways = new ArrayList<>();

        @JsonProperty("IpAddresses")
        private List<IpAddress> ipAddresses = new ArrayList<>();
    }

    /**
     * DHCP lease details. Lease times are Unix epoch seconds.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Dhcp {

        @JsonProperty("LeaseExpires")
        private long leaseExpires;

        @JsonProperty("LeaseObtained")
        private long leaseObtained;

        @JsonProperty("Address")
        private IpAddress address;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IpAddress {

        @JsonProperty("IpAddress")
        private String ipAddress;

        @JsonProperty("Mask")
        private String mask;
    }
}
