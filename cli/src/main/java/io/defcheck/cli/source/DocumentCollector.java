package io.defcheck.cli.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.defcheck.core.model.SourceDocument;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and parses the JSON documents of a run.
 *
 * <p>
 * Documents named on the command line are used as given; otherwise every
 * {@code *.json} file directly inside the documents directory is used, sorted by
 * file name. A file that is not valid JSON becomes an unparseable
 * {@link SourceDocument} instead of failing the run.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class DocumentCollector {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCollector.class);
    // content after the first JSON value makes the whole file unparseable
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private DocumentCollector() {
        // utility class
    }

    /**
     * Determines the document files of a run.
     *
     * @param explicit     files from the command line, possibly empty
     * @param documentsDir directory scanned when {@code explicit} is empty
     * @return the files to validate, never empty
     * @throws DocumentSourceException if the directory is missing or holds no documents
     */
    public static List<Path> collect(List<Path> explicit, Path documentsDir) {
        if (!explicit.isEmpty()) {
            return List.copyOf(explicit);
        }
        if (!Files.isDirectory(documentsDir)) {
            throw new DocumentSourceException(documentsDir + " not found.");
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(documentsDir, "*.json")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot list " + documentsDir, e);
        }
        if (files.isEmpty()) {
            throw new DocumentSourceException("No JSON files to validate in " + documentsDir);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        LOG.debug("Found {} documents in {}", files.size(), documentsDir);
        return files;
    }

    /**
     * Reads and parses one document. The id is the file name.
     *
     * @throws DocumentSourceException if the file cannot be read at all
     */
    public static SourceDocument read(Path file) {
        String id = file.getFileName().toString();
        try {
            JsonNode content = MAPPER.readTree(file.toFile());
            if (content == null || content.isMissingNode()) {
                return SourceDocument.unparseable(id, "No content to parse: empty document");
            }
            return SourceDocument.parsed(id, content);
        } catch (JsonProcessingException e) {
            LOG.debug("Cannot parse {}: {}", file, e.getOriginalMessage());
            return SourceDocument.unparseable(id, e.getOriginalMessage());
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot read " + file, e);
        }
    }

    /** Reads all files in order. */
    public static List<SourceDocument> readAll(List<Path> files) {
        List<SourceDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(read(file));
        }
        return documents;
    }
}
