package io.github.yok.clickload.source;

import java.io.IOException;

/**
 * Already-authenticated handle on a remote file-download service.
 *
 * @author Yasuharu.Okawauchi
 * @see DriveFileSource
 */
public interface RemoteFileSource {

    /**
     * @param fileId remote file ID
     * @return metadata of the file
     * @throws IOException if the file does not exist or the service fails
     */
    RemoteFileMetadata getMetadata(String fileId) throws IOException;

    /**
     * Downloads the file content. Progress is reported through the implementation's logger.
     *
     * @param fileId remote file ID
     * @return file content
     * @throws IOException if the download fails
     */
    byte[] download(String fileId) throws IOException;
}
