package in.fxledger.infrastructure.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxledger.application.port.output.SnapshotStore;
import in.fxledger.domain.common.MalformedPayloadException;
import in.fxledger.domain.model.CaptureMethod;
import in.fxledger.domain.model.CapturedSnapshot;
import in.fxledger.domain.model.RawSnapshot;
import in.fxledger.domain.model.SnapshotRef;
import in.fxledger.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Snapshot store on the local filesystem.
 *
 * Layout under the root directory:
 * <pre>
 * vcb/vcb_rates_1769678700000.json
 * vcb/vcb_rates_1769678700000.xml      (original response body)
 * vcb/vcb_rates_latest.json
 * vcb/vcb_rates_latest.xml
 * xe/xe_USD_VND_1769678700000.json
 * xe/xe_USD_VND_latest.json
 * </pre>
 *
 * Payloads are stored verbatim. The capture time of a file is the payload's
 * {@code capturedAt} field when present, else the millis in the file name, else
 * the file's modification time.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private static final String LATEST = "latest";
    private static final String EXTENSION = ".json";

    private final Path root;
    private final ObjectMapper mapper;

    public FileSnapshotStore(Path root, ObjectMapper mapper) {
        this.root = root;
        this.mapper = mapper;
    }

    @Override
    public SnapshotRef save(SourceKind source, String identifier, RawSnapshot snapshot) {
        Path dir = directory(source);
        Instant capturedAt = snapshot.capturedAt();
        Path file = dir.resolve(fileName(source, identifier, Long.toString(capturedAt.toEpochMilli())));
        Path latest = dir.resolve(fileName(source, identifier, LATEST));
        try {
            Files.createDirectories(dir);
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot.payload());
            writeAtomically(file, bytes);
            writeAtomically(latest, bytes);
        } catch (IOException e) {
            log.error("[{}] Failed to save snapshot {}: {}", source.sourceName(), file, e.getMessage());
            throw new UncheckedIOException("Failed to save snapshot " + file, e);
        }
        log.debug("[{}] Saved snapshot {}", source.sourceName(), file);
        return new SnapshotRef(source, identifier, file, capturedAt, false);
    }

    @Override
    public Path saveOriginal(SourceKind source, String identifier, Instant capturedAt, CapturedSnapshot.Original original) {
        Path dir = directory(source);
        String extension = "." + original.extension();
        Path file = dir.resolve(baseName(source, identifier, Long.toString(capturedAt.toEpochMilli())) + extension);
        Path latest = dir.resolve(baseName(source, identifier, LATEST) + extension);
        try {
            Files.createDirectories(dir);
            byte[] bytes = original.content().getBytes(StandardCharsets.UTF_8);
            writeAtomically(file, bytes);
            writeAtomically(latest, bytes);
        } catch (IOException e) {
            log.error("[{}] Failed to save original {}: {}", source.sourceName(), file, e.getMessage());
            throw new UncheckedIOException("Failed to save original " + file, e);
        }
        log.debug("[{}] Saved original {}", source.sourceName(), file);
        return file;
    }

    @Override
    public RawSnapshot read(SnapshotRef ref) {
        JsonNode payload;
        try {
            payload = mapper.readTree(ref.path().toFile());
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(ref.source().sourceName(),
                "unreadable snapshot " + ref.path().getFileName() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + ref.path(), e);
        }
        if (payload == null || payload.isMissingNode()) {
            throw new MalformedPayloadException(ref.source().sourceName(), "empty snapshot " + ref.path().getFileName());
        }
        CaptureMethod method = CaptureMethod.fromWire(payload.path("method").isTextual() ? payload.path("method").asText() : null);
        return new RawSnapshot(payload, captureTime(ref, payload), method);
    }

    @Override
    public Optional<SnapshotRef> findLatest(SourceKind source, String identifier) {
        Path latest = directory(source).resolve(fileName(source, identifier, LATEST));
        if (!Files.isRegularFile(latest)) {
            return Optional.empty();
        }
        return Optional.of(new SnapshotRef(source, identifier, latest, null, true));
    }

    @Override
    public List<SnapshotRef> listLatest(SourceKind source) {
        List<SnapshotRef> refs = new ArrayList<>();
        for (SnapshotRef ref : scan(source)) {
            if (ref.latest()) refs.add(ref);
        }
        refs.sort(Comparator.comparing(SnapshotRef::identifier));
        return refs;
    }

    @Override
    public List<SnapshotRef> listHistorical(SourceKind source) {
        List<SnapshotRef> refs = new ArrayList<>();
        for (SnapshotRef ref : scan(source)) {
            if (!ref.latest()) refs.add(ref);
        }
        refs.sort(Comparator.comparing(SnapshotRef::capturedAt).thenComparing(r -> r.path().getFileName().toString()));
        return refs;
    }

    public Path directory(SourceKind source) {
        return root.resolve(source.code());
    }

    private List<SnapshotRef> scan(SourceKind source) {
        Path dir = directory(source);
        List<SnapshotRef> refs = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return refs;
        }
        Pattern pattern = Pattern.compile("^" + Pattern.quote(source.code()) + "_(.+)_(" + LATEST + "|\\d+)" + Pattern.quote(EXTENSION) + "$");
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(path -> {
                Matcher m = pattern.matcher(path.getFileName().toString());
                if (!m.matches()) return;
                String identifier = m.group(1);
                if (LATEST.equals(m.group(2))) {
                    refs.add(new SnapshotRef(source, identifier, path, null, true));
                } else {
                    refs.add(new SnapshotRef(source, identifier, path, Instant.ofEpochMilli(Long.parseLong(m.group(2))), false));
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list snapshots in " + dir, e);
        }
        return refs;
    }

    private Instant captureTime(SnapshotRef ref, JsonNode payload) {
        JsonNode field = payload.get("capturedAt");
        if (field != null && field.canConvertToLong() && field.isNumber()) {
            return Instant.ofEpochMilli(field.asLong());
        }
        if (field != null && field.isTextual()) {
            try {
                return OffsetDateTime.parse(field.asText()).toInstant();
            } catch (DateTimeException e) {
                log.debug("[{}] Ignoring unparseable capturedAt '{}' in {}", ref.source().sourceName(), field.asText(), ref.path());
            }
        }
        if (ref.capturedAt() != null) {
            return ref.capturedAt();
        }
        try {
            return Files.getLastModifiedTime(ref.path()).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat snapshot " + ref.path(), e);
        }
    }

    private static String fileName(SourceKind source, String identifier, String suffix) {
        return baseName(source, identifier, suffix) + EXTENSION;
    }

    private static String baseName(SourceKind source, String identifier, String suffix) {
        return source.code() + "_" + identifier + "_" + suffix;
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
