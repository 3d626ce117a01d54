package org.muma.xredis.rdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * 基于本地文件的快照存储
 * 先写临时文件再 rename，崩溃时旧快照保持完整。
 */
public class FileSnapshotGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotGateway.class);

    private final Path file;

    public FileSnapshotGateway(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void save(byte[] blob) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tempFile = file.resolveSibling("temp-" + file.getFileName());

        Files.write(tempFile, blob, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE, StandardOpenOption.SYNC);

        // Atomic Rename
        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", file);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("DB saved on disk: {}, size: {} bytes", file, blob.length);
    }

    @Override
    public Optional<byte[]> load() throws IOException {
        try {
            byte[] blob = Files.readAllBytes(file);
            log.info("Loaded snapshot file: {}, size: {} bytes", file, blob.length);
            return Optional.of(blob);
        } catch (NoSuchFileException e) {
            log.info("No snapshot file to load: {}", file);
            return Optional.empty();
        }
    }
}
