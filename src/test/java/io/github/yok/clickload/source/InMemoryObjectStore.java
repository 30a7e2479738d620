package io.github.yok.clickload.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ObjectStore} backed by an ordered map, for tests.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final String bucket;
    private final Map<String, byte[]> objects = new LinkedHashMap<>();
    private final List<String> listedPrefixes = new ArrayList<>();
    private IOException listingFailure;

    public InMemoryObjectStore(String bucket) {
        this.bucket = bucket;
    }

    /**
     * Adds an object; listing order follows insertion order.
     */
    public InMemoryObjectStore put(String key, String content) {
        objects.put(key, content.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public void failListingWith(IOException failure) {
        this.listingFailure = failure;
    }

    public List<String> getListedPrefixes() {
        return listedPrefixes;
    }

    @Override
    public String getBucket() {
        return bucket;
    }

    @Override
    public List<String> listObjects(String prefix) throws IOException {
        listedPrefixes.add(prefix);
        if (listingFailure != null) {
            throw listingFailure;
        }
        List<String> keys = new ArrayList<>();
        for (String key : objects.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public byte[] download(String key) throws IOException {
        byte[] content = objects.get(key);
        if (content == null) {
            throw new IOException("NoSuchKey: " + key);
        }
        return content;
    }

    @Override
    public String objectUrl(String key) {
        return "https://" + bucket + ".s3.amazonaws.com/" + key;
    }
}
