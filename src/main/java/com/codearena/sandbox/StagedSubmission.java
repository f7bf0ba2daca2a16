package com.codearena.sandbox;

import com.codearena.core.execution.StagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

/**
 * Files staged for one submission. Closing removes all of them; removal
 * failures are logged and never mask the submission's result.
 */
public class StagedSubmission implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagedSubmission.class);

    private final Path directory;
    private final String submissionId;
    private final List<Path> files = new ArrayList<>();

    StagedSubmission(Path directory, String submissionId) {
        this.directory = directory;
        this.submissionId = submissionId;
    }

    public String submissionId() {
        return submissionId;
    }

    /**
     * Writes {@code <submissionId><suffix>} into the staging directory.
     *
     * @param suffix file name suffix, e.g. {@code ".ts"} or {@code "-tests.json"}
     * @return absolute path of the written file
     */
    public Path write(String suffix, String content) {
        Path file = directory.resolve(submissionId + suffix);
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StagingException("Failed to write " + file, e);
        }
        return track(file);
    }

    /**
     * Copies a classpath resource to {@code <submissionId><suffix>}.
     */
    public Path copyResource(String resource, String suffix) {
        Path file = directory.resolve(submissionId + suffix);
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StagingException("Failed to stage resource " + resource, e);
        }
        return track(file);
    }

    public List<Path> files() {
        return List.copyOf(files);
    }

    @Override
    public void close() {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Could not remove staged file {}: {}", file, e.getMessage());
            }
        }
        files.clear();
    }

    private Path track(Path file) {
        files.add(file);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            try {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw-rw-"));
            } catch (IOException e) {
                log.debug("Could not set permissions on {}: {}", file, e.getMessage());
            }
        }
        return file;
    }
}
