package org.impactengine.storage;

import com.typesafe.config.Config;
import org.impactengine.api.storage.IStorageAdapter;
import org.impactengine.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local file system backend. Each job is a directory {@code <storage_url>/<job_id>}.
 * <p>
 * Writes are atomic: data goes to a {@code .UUID.tmp} sibling first and is then moved into
 * place, so a reader never sees a half-written artifact. Temporary files are hidden from
 * {@link #list()}.
 * <p>
 * <strong>Configuration:</strong>
 * <ul>
 *   <li>{@code storage_url}: root directory; {@code ${VAR}} and a leading {@code ~} are expanded,
 *       relative paths resolve against the working directory. A {@code file://} prefix is accepted.</li>
 *   <li>{@code job_id}: name of the job directory.</li>
 * </ul>
 */
public class FileSystemStorageAdapter implements IStorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStorageAdapter.class);
    private static final String FILE_SCHEME = "file://";
    private static final String TEMP_SUFFIX = ".tmp";

    private File jobRoot;

    @Override
    public boolean connect(Config config) {
        if (jobRoot != null) {
            throw new IllegalStateException("FileSystemStorageAdapter is already connected to " + jobRoot);
        }
        if (!config.hasPath("storage_url")) {
            throw new IllegalArgumentException("storage_url is required for FileSystemStorageAdapter");
        }
        if (!config.hasPath("job_id")) {
            throw new IllegalArgumentException("job_id is required for FileSystemStorageAdapter");
        }
        String url = config.getString("storage_url");
        if (url.startsWith(FILE_SCHEME)) {
            url = url.substring(FILE_SCHEME.length());
        }
        String jobId = config.getString("job_id");
        validateKey(jobId);
        if (jobId.contains("/")) {
            throw new IllegalArgumentException("job_id must be a single path segment: " + jobId);
        }

        File root = new File(PathExpansion.expandPath(url)).getAbsoluteFile();
        File candidate = new File(root, jobId);
        if (!candidate.exists() && !candidate.mkdirs()) {
            log.warn("Failed to create job directory {}", candidate);
            return false;
        }
        if (!candidate.isDirectory()) {
            log.warn("Job location {} exists but is not a directory", candidate);
            return false;
        }
        this.jobRoot = candidate;
        log.debug("File system storage connected at {}", jobRoot);
        return true;
    }

    @Override
    public void write(String key, byte[] data) throws IOException {
        File file = resolve(key);

        File parentDir = file.getParentFile();
        if (parentDir != null) {
            parentDir.mkdirs();
            if (!parentDir.isDirectory()) {
                throw new IOException("Failed to create parent directories for: " + file.getAbsolutePath());
            }
        }

        File tempFile = new File(parentDir, file.getName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        Files.write(tempFile.toPath(), data);
        try {
            Files.move(tempFile.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile.toPath());
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
        log.debug("Wrote {} bytes to {}", data.length, file);
    }

    @Override
    public byte[] read(String key) throws IOException {
        File file = resolve(key);
        if (!file.isFile()) {
            throw new IOException("File does not exist: " + key + " (" + file.getAbsolutePath() + ")");
        }
        return Files.readAllBytes(file.toPath());
    }

    @Override
    public boolean exists(String key) {
        return resolve(key).isFile();
    }

    @Override
    public List<String> list() throws IOException {
        Path rootPath = requireConnected().toPath();
        try (Stream<Path> files = Files.walk(rootPath)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().endsWith(TEMP_SUFFIX))
                .map(path -> rootPath.relativize(path).toString().replace(File.separatorChar, '/'))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public String fullPath(String key) {
        return resolve(key).getAbsolutePath();
    }

    @Override
    public String rootPath() {
        return requireConnected().getAbsolutePath();
    }

    @Override
    public boolean validateConnection() {
        return jobRoot != null && jobRoot.isDirectory();
    }

    private File resolve(String key) {
        validateKey(key);
        return new File(requireConnected(), key);
    }

    private File requireConnected() {
        if (jobRoot == null) {
            throw new IllegalStateException("FileSystemStorageAdapter is not connected. Call connect() first.");
        }
        return jobRoot;
    }

    /**
     * Rejects keys that could escape the job root or are invalid on common file systems.
     */
    static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (key.contains("..")) {
            throw new IllegalArgumentException("Key cannot contain '..' (path traversal attempt): " + key);
        }
        if (key.startsWith("/") || key.startsWith("\\")) {
            throw new IllegalArgumentException("Key cannot be an absolute path: " + key);
        }
        if (key.length() >= 2 && key.charAt(1) == ':') {
            throw new IllegalArgumentException("Key cannot contain Windows drive letter: " + key);
        }
        String invalidChars = "<>\"?*|";
        for (char c : invalidChars.toCharArray()) {
            if (key.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Key contains invalid character '" + c + "': " + key);
            }
        }
        for (char c : key.toCharArray()) {
            if (c < 0x20) {
                throw new IllegalArgumentException("Key contains control character (0x"
                    + Integer.toHexString(c) + "): " + key);
            }
        }
    }
}
