package io.github.yok.clickload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code drive} section in {@code application.yml}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "drive")
@Data
public class DriveConfig {

    // Service-account JSON key; blank uses Application Default Credentials
    private String credentialsPath;

    // Application name reported to the Drive API
    private String applicationName = "clickload";
}
