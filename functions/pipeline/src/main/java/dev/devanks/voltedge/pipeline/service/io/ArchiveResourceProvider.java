package dev.devanks.voltedge.pipeline.service.io;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import dev.devanks.voltedge.pipeline.exception.ArchiveIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens the compressed raw-readings archive. The returned stream owns the file handle.
 */
@Component
@Slf4j
public class ArchiveResourceProvider {

    /**
     * Opens the archive and positions the stream on its data file (the first non-directory entry).
     *
     * @param archivePath path of the zip archive
     * @return a stream over the uncompressed text; closing it releases the archive
     */
    public InputStream openArchive(Path archivePath) {
        if (!Files.isRegularFile(archivePath)) {
            throw new ArchiveIntegrityException("Archive not found: " + archivePath);
        }
        ZipInputStream zip = null;
        try {
            zip = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archivePath)));
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    log.info("Reading entry '{}' from archive {}", entry.getName(), archivePath);
                    return zip;
                }
            }
            zip.close();
            throw new ArchiveIntegrityException("Archive " + archivePath + " contains no data file");
        } catch (IOException e) {
            if (zip != null) {
                try {
                    zip.close();
                } catch (IOException closeEx) {
                    e.addSuppressed(closeEx);
                }
            }
            throw new ArchiveIntegrityException("Failed to open archive " + archivePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Compares the archive's SHA-256 with the expected digest. A blank expectation skips the check.
     */
    public void verifyChecksum(Path archivePath, String expectedSha256) {
        if (expectedSha256 == null || expectedSha256.isBlank()) {
            log.debug("No checksum configured for {}, skipping verification.", archivePath);
            return;
        }
        String actual;
        try {
            actual = MoreFiles.asByteSource(archivePath).hash(Hashing.sha256()).toString();
        } catch (IOException e) {
            throw new ArchiveIntegrityException("Failed to hash archive " + archivePath + ": " + e.getMessage(), e);
        }
        if (!actual.equalsIgnoreCase(expectedSha256.trim())) {
            log.error("Checksum mismatch for {}: expected {}, got {}", archivePath, expectedSha256, actual);
            throw new ArchiveIntegrityException(String.format(
                    "Checksum mismatch for %s: expected %s but was %s", archivePath, expectedSha256, actual));
        }
        log.info("Checksum verified for {}", archivePath);
    }
}
