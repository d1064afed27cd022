package com.deviceapi.dto.response;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Response of {@code GET /api/os/machinename}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MachineName {

    /**
     * The device's computer name. Older firmware reports it as {@code Name}.
     */
    @JsonProperty("ComputerName")
    @JsonAlias("Name")
    private String name;
}
