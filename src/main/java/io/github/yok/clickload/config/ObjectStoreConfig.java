package io.github.yok.clickload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code object-store} section in {@code application.yml}.
 *
 * <p>
 * The same credentials are used for listing/downloading objects and for the store-side
 * {@code s3()} table function that loads binary formats.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "object-store")
@Data
public class ObjectStoreConfig {

    // Bucket holding the source objects
    private String bucket;

    // Region of the bucket
    private String region = "us-east-1";

    // Access key; blank uses the default AWS credentials chain
    private String accessKey;

    // Secret key
    private String secretKey;

    // Endpoint of an S3-compatible service; path-style access is enabled when set
    private String endpoint;

    @Override
    public String toString() {
        return "ObjectStoreConfig(bucket=" + bucket + ", region=" + region + ", endpoint="
                + endpoint + ", accessKey=" + (accessKey == null ? null : "***")
                + ", secretKey=***)";
    }
}
