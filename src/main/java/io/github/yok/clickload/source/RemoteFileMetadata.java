package io.github.yok.clickload.source;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Metadata of a remote file.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@AllArgsConstructor
public class RemoteFileMetadata {

    // Remote file ID
    private String id;

    // Display name, used for logging and to guess the format from its extension
    private String name;

    // MIME type reported by the service; may be null
    private String mimeType;
}
