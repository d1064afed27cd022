package com.deviceapi.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Response of {@code GET /api/os/info}: operating system details reported by the device.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SoftwareInfo {

    @JsonProperty("ComputerName")
    private String computerName;

    @JsonProperty("Language")
    private String language;

    @JsonProperty("OsEdition")
    private String osEdition;

    @JsonProperty("OsEditionId")
    private int osEditionId;

    /**
     * The full build string, e.g. {@code 10.0.17763.107.amd64fre.rs5_release_svc_prod1.181026-1406}.
     */
    @JsonProperty("OsVersion")
    private String osVersion;

    @JsonProperty("Platform")
    private String platform;
}
