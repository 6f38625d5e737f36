package dev.nishisan.actuator.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthPolicyConfig {

    @JsonProperty("diskSpace")
    private DiskSpaceConfig diskSpace;

    public DiskSpaceConfig getDiskSpace() {
        return diskSpace;
    }

    public void setDiskSpace(DiskSpaceConfig diskSpace) {
        this.diskSpace = diskSpace;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DiskSpaceConfig {
        private boolean enabled = true;
        private String path;
        private Long threshold;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Long getThreshold() {
            return threshold;
        }

        public void setThreshold(Long threshold) {
            this.threshold = threshold;
        }
    }
}
