package com.repo.query.service.chunk;

import com.repo.query.model.repo.ChunkType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * splits a source file into code chunks. Python files are cut along their declarations,
 * everything else (and python that does not parse) into fixed line windows.
 */
@Slf4j
@Service
public class ChunkingService {
    private final int windowLines;
    private final PythonStructureParser pythonStructureParser = new PythonStructureParser();

    public ChunkingService(@Value("${query.chunking.window-lines:50}") int windowLines) {
        if (windowLines < 1) throw new IllegalArgumentException("Chunk window must be at least one line");
        this.windowLines = windowLines;
    }

    /**
     * reads and chunks a single file. A file that is empty, unreadable or not text yields no chunks.
     *
     * @param file absolute path of the file
     * @param root root of the cloned repository, used to build the relative path
     * @return chunks in file order
     */
    public List<ChunkData> chunk(Path file, Path root) {
        Optional<String> content = read(file);
        if (content.isEmpty() || content.get().isEmpty()) return List.of();

        String relativePath = relativePath(file, root);
        String language = SourceLanguages.languageOf(file);

        List<ChunkData> chunks = switch (ChunkingStrategy.forLanguage(language)) {
            case STRUCTURAL -> structuralChunks(relativePath, content.get(), language);
            case GENERIC -> genericChunks(relativePath, content.get(), language);
        };

        log.debug("Chunked {} -> {} chunks", relativePath, chunks.size());
        return chunks;
    }

    private List<ChunkData> structuralChunks(String relativePath, String content, String language) {
        Optional<List<ChunkData>> declarations = pythonStructureParser.extract(relativePath, content);

        //  malformed source or a file without declarations falls back to line windows
        if (declarations.isEmpty() || declarations.get().isEmpty())
            return genericChunks(relativePath, content, language);

        return declarations.get();
    }

    /**
     * fixed windows of windowLines lines. Window i covers [i*N+1, min((i+1)*N, totalLines)];
     * whitespace-only windows are dropped.
     *
     * @param relativePath
     * @param content
     * @param language
     * @return
     */
    List<ChunkData> genericChunks(String relativePath, String content, String language) {
        String[] lines = content.split("\n", -1);
        List<ChunkData> chunks = new ArrayList<>();

        for (int start = 0; start < lines.length; start += windowLines) {
            int end = Math.min(start + windowLines, lines.length);
            String text = String.join("\n", Arrays.asList(lines).subList(start, end));
            if (text.isBlank()) continue;

            chunks.add(ChunkData.builder()
                    .filePath(relativePath)
                    .chunkText(text)
                    .chunkType(ChunkType.BLOCK)
                    .lineStart(start + 1)
                    .lineEnd(end)
                    .language(language)
                    .build());
        }
        return chunks;
    }

    /**
     * reads the file as strict utf-8. Binary content and decoding failures are skipped with a warning.
     *
     * @param file
     * @return
     */
    private Optional<String> read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException err) {
            log.warn("Cannot read {}: {}", file, err.getMessage());
            return Optional.empty();
        }
        if (bytes.length == 0) return Optional.of("");

        for (byte b : bytes) {
            if (b == 0) {
                log.warn("Skipping binary file {}", file);
                return Optional.empty();
            }
        }

        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException err) {
            log.warn("Skipping non-text file {}: {}", file, err.getMessage());
            return Optional.empty();
        }
    }

    private String relativePath(Path file, Path root) {
        try {
            return root.toAbsolutePath().normalize()
                    .relativize(file.toAbsolutePath().normalize())
                    .toString()
                    .replace('\\', '/');
        } catch (IllegalArgumentException err) {
            //  file outside the root: keep its name only
            return String.valueOf(file.getFileName());
        }
    }
}
