package com.example.logfilter.rabbitmq.services;

import com.example.logfilter.config.FilterEngineProperties;
import com.example.logfilter.metrics.FilterMetrics;
import com.example.logfilter.rabbitmq.models.PairedFileData;
import com.example.logfilter.rabbitmq.models.PairedFileStatus;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds RabbitMQ message dumps on disk and pairs each {@code msg-<id>} body
 * with its {@code msg-<id>-headers+properties.json} sibling.
 *
 * <p>A directory scan builds the main-file and headers-file maps in parallel on
 * a dedicated pool, then merges them on the calling thread.
 */
@Slf4j
@Service
public class PairedFileDetectionService {

    private static final Pattern MAIN_FILE_PATTERN = Pattern.compile("^msg-(\\d+)$");
    private static final Pattern HEADERS_FILE_PATTERN = Pattern.compile("^msg-(\\d+)-headers\\+properties\\.json$");

    private static final Set<String> UNIFIED_KEYS = Set.of("message", "sentTime", "headers");

    private static final Comparator<String> BY_NUMERIC_ID =
            Comparator.comparing((String id) -> new BigInteger(id)).thenComparing(Comparator.naturalOrder());

    private final ObjectMapper objectMapper;
    private final FilterMetrics metrics;
    private final ForkJoinPool scanPool;

    public PairedFileDetectionService(ObjectMapper objectMapper,
                                      FilterEngineProperties properties,
                                      FilterMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.scanPool = new ForkJoinPool(properties.scanParallelism());
    }

    @PreDestroy
    public void shutdown() {
        scanPool.shutdown();
    }

    public Stream<PairedFileData> detectPairedFiles(Path directory) {
        if (directory == null || directory.toString().isBlank()) {
            log.warn("Directory path is null or empty");
            return Stream.empty();
        }
        if (!Files.isDirectory(directory)) {
            log.warn("Directory does not exist: {}", directory);
            return Stream.empty();
        }

        long startTime = System.nanoTime();
        List<Path> files = listFiles(directory);

        ForkJoinTask<Map<String, Path>> mainTask = scanPool.submit(() -> indexById(files, this::isMainMessageFile));
        ForkJoinTask<Map<String, Path>> headersTask = scanPool.submit(() -> indexById(files, this::isHeadersFile));
        Map<String, Path> mainById = mainTask.join();
        Map<String, Path> headersById = headersTask.join();

        List<PairedFileData> merged = merge(mainById, headersById);
        List<PairedFileData> result = scanPool.submit(() -> merged.parallelStream()
                        .map(this::upgradeIfUnified)
                        .toList())
                .join();

        metrics.recordDirectoryScan(startTime);
        log.info("Detected {} message ids in {} ({} main files, {} headers files)",
                result.size(), directory, mainById.size(), headersById.size());
        return result.stream();
    }

    public PairedFileData findPairedFile(Path mainFile) {
        if (mainFile == null || mainFile.toString().isBlank()) {
            return PairedFileData.createFailed("", "Main file path is null or empty");
        }
        if (!Files.isRegularFile(mainFile)) {
            return PairedFileData.createFailed("", "Main file does not exist: " + mainFile);
        }

        String fileName = mainFile.getFileName().toString();
        Matcher matcher = MAIN_FILE_PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return PairedFileData.createFailed("", "Invalid main file name pattern: " + fileName);
        }

        String messageId = matcher.group(1);
        Path headersFile = mainFile.resolveSibling(headersFileName(messageId));

        PairedFileData pair;
        if (Files.isRegularFile(headersFile)) {
            log.debug("Found complete paired files for message {}", messageId);
            pair = PairedFileData.createComplete(mainFile, headersFile, messageId);
        } else {
            log.debug("Found partial paired files for message {} (headers file missing)", messageId);
            pair = PairedFileData.createPartial(mainFile, messageId);
        }
        return upgradeIfUnified(pair);
    }

    public boolean isMainMessageFile(Path file) {
        return file != null && file.getFileName() != null
                && MAIN_FILE_PATTERN.matcher(file.getFileName().toString()).matches();
    }

    public boolean isHeadersFile(Path file) {
        return file != null && file.getFileName() != null
                && HEADERS_FILE_PATTERN.matcher(file.getFileName().toString()).matches();
    }

    /**
     * @return the numeric id of a main or headers file name, or {@code null} for any other name
     */
    public String extractMessageId(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return null;
        }
        Matcher main = MAIN_FILE_PATTERN.matcher(fileName);
        if (main.matches()) {
            return main.group(1);
        }
        Matcher headers = HEADERS_FILE_PATTERN.matcher(fileName);
        if (headers.matches()) {
            return headers.group(1);
        }
        return null;
    }

    /**
     * A unified dump is a JSON object carrying {@code message}, {@code sentTime}
     * and {@code headers} in the main file itself. Only top-level keys are read;
     * nested values are skipped and the scan stops once all three are seen.
     */
    public boolean isUnifiedJson(Path mainFile) {
        try (JsonParser parser = objectMapper.getFactory().createParser(mainFile.toFile())) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return false;
            }
            Set<String> missing = new HashSet<>(UNIFIED_KEYS);
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                missing.remove(parser.currentName());
                if (missing.isEmpty()) {
                    return true;
                }
                parser.nextToken();
                parser.skipChildren();
            }
            return false;
        } catch (IOException e) {
            log.debug("Main file {} is not unified JSON: {}", mainFile, e.getMessage());
            return false;
        }
    }

    public static String headersFileName(String messageId) {
        return "msg-" + messageId + "-headers+properties.json";
    }

    private List<Path> listFiles(Path directory) {
        try (Stream<Path> listing = Files.list(directory)) {
            return listing.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list directory " + directory, e);
        }
    }

    private Map<String, Path> indexById(List<Path> files, Predicate<Path> kind) {
        return files.parallelStream()
                .filter(kind)
                .collect(Collectors.toConcurrentMap(
                        file -> extractMessageId(file.getFileName().toString()),
                        file -> file));
    }

    private List<PairedFileData> merge(Map<String, Path> mainById, Map<String, Path> headersById) {
        TreeSet<String> ids = new TreeSet<>(BY_NUMERIC_ID);
        ids.addAll(mainById.keySet());
        ids.addAll(headersById.keySet());

        return ids.stream()
                .map(id -> {
                    Path main = mainById.get(id);
                    Path headers = headersById.get(id);
                    if (main != null && headers != null) {
                        return PairedFileData.createComplete(main, headers, id);
                    }
                    if (main != null) {
                        return PairedFileData.createPartial(main, id);
                    }
                    return PairedFileData.createHeadersOnly(headers, id);
                })
                .toList();
    }

    private PairedFileData upgradeIfUnified(PairedFileData pair) {
        if (pair.mainFile() != null && isUnifiedJson(pair.mainFile())) {
            log.debug("Message {} is unified JSON", pair.messageId());
            return pair.withStatus(PairedFileStatus.UNIFIED_JSON);
        }
        return pair;
    }
}
