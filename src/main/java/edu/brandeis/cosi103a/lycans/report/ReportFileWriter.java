package edu.brandeis.cosi103a.lycans.report;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes report files to disk. Files are written atomically so a viewer polling the directory
 * never sees a partial report.
 */
public class ReportFileWriter {

    private final ObjectMapper objectMapper;

    public ReportFileWriter() {
        this.objectMapper = ObjectMapperFactory.createIndenting();
    }

    public void write(Path target, Object report) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), report);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
