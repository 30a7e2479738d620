package io.github.yok.clickload.sql;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import org.apache.commons.io.FileUtils;

/**
 * Reads SQL files (UTF-8) and renders their template variables.
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlFileLoader {

    private final SqlTemplateRenderer renderer;

    public SqlFileLoader(SqlTemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * @param path SQL file path
     * @return {@code true} if the file exists and is a regular file
     */
    public static boolean exists(String path) {
        return path != null && new File(path).isFile();
    }

    /**
     * Loads and renders one SQL file.
     *
     * @param path SQL file path
     * @return rendered SQL
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if the file cannot be read
     */
    public String load(String path) throws IOException {
        if (!exists(path)) {
            throw new NoSuchFileException(path, null, "SQL file not found");
        }
        return renderer.render(FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8));
    }
}
