package io.github.yok.clickload.source;

import java.io.IOException;
import java.util.List;

/**
 * Already-authenticated handle on one object-store bucket.
 *
 * <p>
 * Locators handed around the ingestion run are fully qualified ({@code s3://bucket/key}); keys are
 * relative to the bucket.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see S3ObjectStore
 */
public interface ObjectStore {

    String SCHEME = "s3://";

    /**
     * @return bucket name
     */
    String getBucket();

    /**
     * Lists every key under the prefix. Pagination is handled by the implementation.
     *
     * @param prefix key prefix; empty lists the whole bucket
     * @return keys in listing order
     * @throws IOException if the listing fails
     */
    List<String> listObjects(String prefix) throws IOException;

    /**
     * Downloads one object.
     *
     * @param key object key
     * @return object content
     * @throws IOException if the download fails
     */
    byte[] download(String key) throws IOException;

    /**
     * @return HTTPS URL of an object, as understood by the store-side {@code s3()} table function
     */
    String objectUrl(String key);

    /**
     * Builds the fully qualified locator of a key.
     *
     * @param key object key
     * @return {@code s3://bucket/key}
     */
    default String locatorFor(String key) {
        return SCHEME + getBucket() + "/" + key;
    }

    /**
     * Extracts the key from a locator. Values without the {@code s3://bucket/} prefix are returned
     * as they are.
     *
     * @param locator fully qualified locator or bare key
     * @return object key
     */
    default String keyOf(String locator) {
        String bucketPrefix = SCHEME + getBucket() + "/";
        return locator.startsWith(bucketPrefix) ? locator.substring(bucketPrefix.length())
                : locator;
    }
}
