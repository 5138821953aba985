package br.com.analytics.pipeline.sales_insights_batch.run;

import br.com.analytics.pipeline.sales_insights_batch.config.SourceLayout;
import br.com.analytics.pipeline.sales_insights_batch.model.Fingerprint;
import br.com.analytics.pipeline.sales_insights_batch.model.SourceTag;
import br.com.analytics.pipeline.sales_insights_batch.reader.SourceUnavailableException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Signs the current contents of the source directories: every regular file
 * contributes its relative path, size and modification time.
 */
public class SourceFingerprinter {

    private static final String MISSING_DIRECTORY = "<missing>";

    private final Map<SourceTag, SourceLayout> layouts;

    public SourceFingerprinter(Map<SourceTag, SourceLayout> layouts) {
        this.layouts = new EnumMap<>(layouts);
    }

    public Fingerprint compute() {
        MessageDigest digest = sha256();
        layouts.forEach((source, layout) -> {
            Path directory = layout.directoryPath();
            if (!Files.isDirectory(directory)) {
                update(digest, source + "|" + MISSING_DIRECTORY);
                return;
            }
            for (Path file : listFiles(source, directory)) {
                try {
                    update(digest, source + "|" + directory.relativize(file).toString().replace('\\', '/')
                            + "|" + Files.size(file)
                            + "|" + Files.getLastModifiedTime(file).toMillis());
                } catch (IOException e) {
                    throw new SourceUnavailableException(source, "cannot stat " + file, e);
                }
            }
        });
        return new Fingerprint(HexFormat.of().formatHex(digest.digest()));
    }

    private static List<Path> listFiles(SourceTag source, Path directory) {
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new SourceUnavailableException(source, "cannot list " + directory, e);
        }
    }

    private static void update(MessageDigest digest, String entry) {
        digest.update(entry.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) '\n');
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
