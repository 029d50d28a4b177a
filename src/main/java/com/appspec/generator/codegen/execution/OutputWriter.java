package com.appspec.generator.codegen.execution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.exception.OutputLocationException;
import com.appspec.generator.codegen.model.output.GeneratedFile;
import com.appspec.generator.codegen.model.output.WrittenFile;
import com.appspec.generator.codegen.util.ChecksumUtil;
import com.appspec.generator.codegen.util.FileWriteUtil;

/**
 * Flushes the buffered files of one generator to the output location.
 *
 * All files of the generator are first written next to their targets under a temporary name
 * and only then moved into place, so a write error leaves none of that generator's files
 * behind.
 */
public class OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    private static final String PARTIAL_SUFFIX = ".partial";

    /**
     * Checks that the output root is a writable directory or can be created as one. Does not
     * create anything.
     */
    public void checkUsable(String stackId, Path outputRoot) {
        Path existing = outputRoot.toAbsolutePath().normalize();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new OutputLocationException(stackId, outputRoot, "Output location has no existing ancestor", null);
        }
        if (!Files.isDirectory(existing)) {
            throw new OutputLocationException(stackId, outputRoot, "Output location is not a directory", null);
        }
        if (!Files.isWritable(existing)) {
            throw new OutputLocationException(stackId, outputRoot, "Output location is not writable", null);
        }
    }

    public List<WrittenFile> flush(Path outputRoot, String generatorId, List<GeneratedFile> files) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        List<Path> moved = new ArrayList<>();
        List<WrittenFile> written = new ArrayList<>(files.size());
        Path current = outputRoot;
        try {
            for (GeneratedFile file : files) {
                current = outputRoot.resolve(file.getRelativePath());
                byte[] bytes = file.getContents().getBytes(StandardCharsets.UTF_8);
                Path partial = current.resolveSibling(current.getFileName() + PARTIAL_SUFFIX);
                FileWriteUtil.safeWriteBytes(partial, bytes);
                staged.put(partial, current);
                written.add(WrittenFile.builder()
                        .relativePath(file.getRelativePath())
                        .byteLength(bytes.length)
                        .checksum(ChecksumUtil.sha256(bytes))
                        .generatorId(generatorId)
                        .build());
            }
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                current = entry.getValue();
                move(entry.getKey(), entry.getValue());
                moved.add(entry.getValue());
            }
        } catch (IOException e) {
            discard(staged.keySet());
            discard(moved);
            throw new OutputLocationException(generatorId, current, "Failed to write generated file", e);
        }
        log.debug("Flushed {} file(s) of '{}'", written.size(), generatorId);
        return written;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Collection<Path> paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not remove partially written file {}", path, e);
            }
        }
    }
}
