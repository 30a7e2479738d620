package io.github.yok.clickload.source;

import com.google.api.client.googleapis.media.MediaHttpDownloader;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RemoteFileSource} backed by the Google Drive v3 API.
 *
 * <p>
 * Downloads are chunked so progress can be logged in percent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DriveFileSource implements RemoteFileSource {

    // Chunk size for media downloads
    static final int CHUNK_SIZE = 8 * 1024 * 1024;

    private final Drive drive;

    public DriveFileSource(Drive drive) {
        this.drive = drive;
    }

    @Override
    public RemoteFileMetadata getMetadata(String fileId) throws IOException {
        File file = drive.files().get(fileId).setFields("id,name,mimeType").execute();
        String name = file.getName() == null ? "unknown_file" : file.getName();
        return new RemoteFileMetadata(fileId, name, file.getMimeType());
    }

    @Override
    public byte[] download(String fileId) throws IOException {
        Drive.Files.Get request = drive.files().get(fileId);
        MediaHttpDownloader downloader = request.getMediaHttpDownloader();
        downloader.setDirectDownloadEnabled(false).setChunkSize(CHUNK_SIZE);
        downloader.setProgressListener(d -> {
            if (d.getDownloadState() == MediaHttpDownloader.DownloadState.MEDIA_IN_PROGRESS
                    || d.getDownloadState() == MediaHttpDownloader.DownloadState.MEDIA_COMPLETE) {
                log.info("Download progress: {}%", (int) (d.getProgress() * 100));
            }
        });

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        request.executeMediaAndDownloadTo(out);
        return out.toByteArray();
    }
}
