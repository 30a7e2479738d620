package io.github.yok.clickload.source;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import io.github.yok.clickload.config.DriveConfig;
import io.github.yok.clickload.config.ObjectStoreConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.Collections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds authenticated source clients from configuration.
 *
 * <p>
 * <strong>Credentials:</strong>
 * </p>
 * <ul>
 * <li>Object store: static keys when {@code object-store.access-key} is set, otherwise the default
 * AWS credentials chain. A configured endpoint switches to path-style access for S3-compatible
 * services.</li>
 * <li>Drive: the service-account key at {@code drive.credentials-path} when set, otherwise
 * Application Default Credentials; read-only scope.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceClientFactory {

    private final ObjectStoreConfig objectStoreConfig;
    private final DriveConfig driveConfig;

    /**
     * Creates the object store handle for the configured bucket.
     *
     * @return object store
     * @throws IllegalStateException if no bucket is configured
     */
    public ObjectStore objectStore() {
        if (StringUtils.isBlank(objectStoreConfig.getBucket())) {
            throw new IllegalStateException("object-store.bucket is not configured");
        }
        return new S3ObjectStore(s3Client(), objectStoreConfig.getBucket());
    }

    /**
     * Creates the remote file source.
     *
     * @return Drive-backed file source
     * @throws IOException if the credentials cannot be read
     */
    public RemoteFileSource remoteFileSource() throws IOException {
        GoogleCredentials credentials;
        if (StringUtils.isNotBlank(driveConfig.getCredentialsPath())) {
            try (InputStream in =
                    Files.newInputStream(Paths.get(driveConfig.getCredentialsPath()))) {
                credentials = GoogleCredentials.fromStream(in);
            }
        } else {
            credentials = GoogleCredentials.getApplicationDefault();
        }
        credentials = credentials.createScoped(Collections.singleton(DriveScopes.DRIVE_READONLY));

        try {
            Drive drive = new Drive.Builder(GoogleNetHttpTransport.newTrustedTransport(),
                    GsonFactory.getDefaultInstance(), new HttpCredentialsAdapter(credentials))
                            .setApplicationName(driveConfig.getApplicationName()).build();
            return new DriveFileSource(drive);
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to initialize the Drive HTTP transport", e);
        }
    }

    AmazonS3 s3Client() {
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
        if (StringUtils.isNotBlank(objectStoreConfig.getAccessKey())) {
            builder.withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(
                    objectStoreConfig.getAccessKey(), objectStoreConfig.getSecretKey())));
        } else {
            builder.withCredentials(new DefaultAWSCredentialsProviderChain());
        }
        if (StringUtils.isNotBlank(objectStoreConfig.getEndpoint())) {
            log.info("Using S3-compatible endpoint {}", objectStoreConfig.getEndpoint());
            builder.withEndpointConfiguration(new EndpointConfiguration(
                    objectStoreConfig.getEndpoint(), objectStoreConfig.getRegion()));
            builder.withPathStyleAccessEnabled(true);
        } else {
            builder.withRegion(objectStoreConfig.getRegion());
        }
        return builder.build();
    }
}
