package io.github.yok.clickload.source;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectInputStream;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

/**
 * {@link ObjectStore} backed by the AWS SDK {@link AmazonS3} client.
 *
 * <p>
 * Listing follows {@code ListObjectsV2} continuation tokens until the result is no longer
 * truncated. SDK exceptions are rethrown as {@link IOException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private final AmazonS3 s3Client;
    private final String bucket;

    public S3ObjectStore(AmazonS3 s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public String getBucket() {
        return bucket;
    }

    @Override
    public List<String> listObjects(String prefix) throws IOException {
        List<String> keys = new ArrayList<>();
        ListObjectsV2Request request =
                new ListObjectsV2Request().withBucketName(bucket).withPrefix(prefix);
        try {
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    // Skip directory markers
                    if (!summary.getKey().endsWith("/")) {
                        keys.add(summary.getKey());
                    }
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (SdkClientException e) {
            throw new IOException("Error listing s3://" + bucket + "/" + prefix, e);
        }
        log.debug("Listed {} objects under s3://{}/{}", keys.size(), bucket, prefix);
        return keys;
    }

    @Override
    public byte[] download(String key) throws IOException {
        log.info("Downloading s3://{}/{}", bucket, key);
        try (S3Object object = s3Client.getObject(bucket, key);
                S3ObjectInputStream in = object.getObjectContent()) {
            return IOUtils.toByteArray(in);
        } catch (SdkClientException e) {
            throw new IOException("Error downloading s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public String objectUrl(String key) {
        return s3Client.getUrl(bucket, key).toString();
    }
}
