package io.github.yok.clickload.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.clickload.config.DriveConfig;
import io.github.yok.clickload.config.ObjectStoreConfig;
import java.io.File;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceClientFactoryTest {

    @TempDir
    File tmpDir;

    private ObjectStoreConfig objectStoreConfig;
    private DriveConfig driveConfig;
    private SourceClientFactory factory;

    @BeforeEach
    void setup() {
        objectStoreConfig = new ObjectStoreConfig();
        driveConfig = new DriveConfig();
        factory = new SourceClientFactory(objectStoreConfig, driveConfig);
    }

    @Test
    void objectStore_異常ケース_バケット未設定_IllegalStateExceptionとなること() {
        objectStoreConfig.setBucket(" ");

        IllegalStateException ex =
                assertThrows(IllegalStateException.class, () -> factory.objectStore());

        assertEquals("object-store.bucket is not configured", ex.getMessage());
    }

    @Test
    void objectStore_正常ケース_互換エンドポイントと固定キー_バケットに紐づくストアが返ること() {
        objectStoreConfig.setBucket("lake");
        objectStoreConfig.setAccessKey("minio");
        objectStoreConfig.setSecretKey("minio123");
        objectStoreConfig.setEndpoint("http://localhost:9000");

        ObjectStore store = factory.objectStore();

        assertTrue(store instanceof S3ObjectStore);
        assertEquals("lake", store.getBucket());
        assertEquals("s3://lake/a/b.csv", store.locatorFor("a/b.csv"));
    }

    @Test
    void remoteFileSource_異常ケース_認証ファイルが存在しない_IOExceptionとなること() {
        driveConfig.setCredentialsPath(new File(tmpDir, "missing.json").getPath());

        assertThrows(IOException.class, () -> factory.remoteFileSource());
    }
}
