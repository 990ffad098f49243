package org.lexcrawl.util;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.jwarc.WarcCompression;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcWriter;
import org.netpreserve.jwarc.Warcinfo;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Appends records to a gzipped WARC file and moves on to a fresh file once the current one reaches the size limit.
 * Not thread-safe; callers hand instances out through a pool.
 */
public class WarcRotator implements Closeable {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);
    private static final String SUFFIX_ALPHABET = "ABCDFGHJKLMNPQRSTVWXYZabcdfghjklmnpqrstvwxyz0123456789";
    private final Path directory;
    private final String prefix;
    private final long maxFileSize;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private @Nullable WarcWriter writer;
    private @Nullable String filename;

    public WarcRotator(Path directory, String prefix, long maxFileSize, Clock clock) {
        this.directory = directory;
        this.prefix = prefix;
        this.maxFileSize = maxFileSize;
        this.clock = clock;
    }

    /**
     * Writes the record, opening a file first if none is open.
     *
     * @return {@code <filename>@<offset>} of the record
     */
    public String append(WarcRecord record) throws IOException {
        if (writer == null) startFile();
        String ref = filename + "@" + writer.position();
        writer.write(record);
        if (writer.position() >= maxFileSize) close();
        return ref;
    }

    private void startFile() throws IOException {
        String name = prefix + "-" + TIMESTAMP.format(clock.instant()) + "-" + randomSuffix(5) + ".warc.gz";
        writer = new WarcWriter(FileChannel.open(directory.resolve(name), WRITE, CREATE_NEW), WarcCompression.GZIP);
        writer.write(new Warcinfo.Builder()
                .filename(name)
                .date(clock.instant())
                .fields(Map.of("software", List.of("lexcrawl"),
                        "format", List.of("WARC File Format 1.1"),
                        "description", List.of("Raw content of fetched legal documents")))
                .build());
        filename = name;
    }

    private String randomSuffix(int length) {
        return random.ints(length, 0, SUFFIX_ALPHABET.length())
                .mapToObj(i -> String.valueOf(SUFFIX_ALPHABET.charAt(i)))
                .collect(Collectors.joining());
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
            filename = null;
        }
    }
}
