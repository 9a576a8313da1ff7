package dev.devanks.voltedge.pipeline.service.io;

import dev.devanks.voltedge.pipeline.exception.ExportException;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class OutputResourceProvider {

    public WritableResource createWritableResource(String outputPath) {
        Path path = Path.of(outputPath);
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ExportException("Cannot create output directory " + parent, e);
        }
        return new FileSystemResource(path);
    }
}
