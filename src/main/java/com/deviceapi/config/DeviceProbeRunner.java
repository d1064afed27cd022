package com.deviceapi.config;

import com.deviceapi.dto.response.AppXPackages;
import com.deviceapi.dto.response.IpConfig;
import com.deviceapi.dto.response.MachineName;
import com.deviceapi.dto.response.SoftwareInfo;
import com.deviceapi.service.api.DeviceApi;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Queries the configured device once on startup and logs what it reports.
 * <p>
 * Enabled with {@code device.api.probe-on-startup=true}. A failing device is logged and does
 * not prevent the application from starting.
 */
@Component
@Profile("!test")
@ConditionalOnProperty(prefix = "device.api", name = "probe-on-startup", havingValue = "true")
@Slf4j
public class DeviceProbeRunner implements CommandLineRunner {

    private final ObjectProvider<DeviceApi> deviceApi;

    public DeviceProbeRunner(ObjectProvider<DeviceApi> deviceApi) {
        this.deviceApi = deviceApi;
    }

    @Override
    public void run(String... args) {
        DeviceApi api = deviceApi.getIfAvailable();
        if (api == null) {
            log.warn("Startup probe enabled but device.api.url is not set. Skipping.");
            return;
        }
        try {
            describe(api).forEach(log::info);
        } catch (Exception e) {
            log.error("Startup probe of {} failed", api.getConnection().baseUrl(), e);
        }
    }

    /**
     * Fetches every endpoint in turn and summarizes the answers, one line per endpoint.
     */
    List<String> describe(DeviceApi api) {
        List<String> lines = new ArrayList<>();
        lines.add("Machine name: " + api.getMachineName().blockOptional()
                .map(MachineName::getName)
                .orElse("<no data>"));
        lines.add("OS version: " + api.getSoftwareInfo().blockOptional()
                .map(SoftwareInfo::getOsVersion)
                .orElse("<no data>"));
        lines.add("Network adapters: " + api.getIpConfig().blockOptional()
                .map(IpConfig::getAdapters)
                .map(adapters -> String.valueOf(adapters.size()))
                .orElse("<no data>"));
        lines.add("Installed packages: " + api.getInstalledPackages().blockOptional()
                .map(AppXPackages::getInstalledPackages)
                .map(packages -> String.valueOf(packages.size()))
                .orElse("<no data>"));
        return lines;
    }
}
