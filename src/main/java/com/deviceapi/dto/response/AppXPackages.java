package com.deviceapi.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Response of {@code GET /api/appx/packagemanager/packages}: the AppX packages installed on
 * the device.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppXPackages {

    @JsonProperty("InstalledPackages")
    private List<AppXPackage> installedPackages = new ArrayList<>();

    /**
     * One installed package.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AppXPackage {

        @JsonProperty("Name")
        private String name;

        @JsonProperty("PackageFamilyName")
        private String packageFamilyName;

        /**
         * The identifier used when uninstalling or launching the package.
         */
        @JsonProperty("PackageFullName")
        private String packageFullName;

        @JsonProperty("PackageOrigin")
        private int packageOrigin;

        @JsonProperty("PackageRelativeId")
        private String packageRelativeId;

        @JsonProperty("Publisher")
        private String publisher;

        @JsonProperty("Version")
        private PackageVersion version;

        @JsonProperty("CanUninstall")
        private boolean canUninstall;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PackageVersion {

        @JsonProperty("Major")
        private int major;

        @JsonProperty("Minor")
        private int minor;

        @JsonProperty("Build")
        private int build;

        @JsonProperty("Revision")
        private int revision;

        @Override
        public String toString() {
            return major + "." + minor + "." + build + "." + revision;
        }
    }
}
