package com.codearena.sandbox;

import com.codearena.core.execution.StagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Host directory where submission files are written before they are mounted
 * into a sandbox. Every file of a submission is named after its submission id,
 * so concurrent submissions never collide.
 */
public class StagingArea {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path root;

    public StagingArea(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * Opens a staging scope for one submission, creating the root directory
     * if needed. Closing the scope deletes every file written through it.
     *
     * @throws StagingException if the root directory cannot be created
     */
    public StagedSubmission open(String submissionId) {
        ensureRoot();
        return new StagedSubmission(root, submissionId);
    }

    /** Whether the root exists (or can be created) and is writable. */
    public boolean isWritable() {
        try {
            ensureRoot();
            return Files.isWritable(root);
        } catch (StagingException e) {
            log.debug("Staging directory {} unavailable: {}", root, e.getMessage());
            return false;
        }
    }

    private void ensureRoot() {
        if (Files.isDirectory(root)) {
            return;
        }
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StagingException("Failed to create staging directory " + root, e);
        }
        // Sandbox processes may run as a different user than this one
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            try {
                Files.setPosixFilePermissions(root, PosixFilePermissions.fromString("rwxrwxrwx"));
            } catch (IOException e) {
                log.warn("Could not open permissions on staging directory {}: {}", root, e.getMessage());
            }
        }
        log.info("Created staging directory {}", root);
    }
}
