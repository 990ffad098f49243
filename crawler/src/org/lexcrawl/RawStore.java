package org.lexcrawl;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.util.Url;
import org.lexcrawl.util.WarcRotator;
import org.netpreserve.jwarc.MediaType;
import org.netpreserve.jwarc.WarcDigest;
import org.netpreserve.jwarc.WarcReader;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * Archives fetched bodies as WARC resource records so they can be normalized again without refetching.
 * <p>
 * A reference has the form {@code <filename>@<offset>}. Each record is its own gzip member, so a reader can seek
 * straight to the offset.
 */
public class RawStore implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(RawStore.class);
    static final String STRATEGY_HEADER = "WARC-Lexcrawl-Strategy";
    static final String STATUS_HEADER = "WARC-Lexcrawl-Status";
    private static final long MAX_FILE_SIZE = 1024L * 1024 * 1024;
    private final BlockingDeque<WarcRotator> warcPool;
    private final Path warcsDir;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();
    private final int poolSize;

    public RawStore(Path jobDir, String prefix, int poolSize, Clock clock) throws IOException {
        this.poolSize = poolSize;
        this.warcsDir = jobDir.resolve("warcs");
        Files.createDirectories(warcsDir);
        warcPool = new LinkedBlockingDeque<>(poolSize);
        if (prefix == null) prefix = "lexcrawl";
        for (int i = 0; i < poolSize; i++) {
            warcPool.add(new WarcRotator(warcsDir, prefix, MAX_FILE_SIZE, clock));
        }
    }

    /**
     * Appends the content as a resource record.
     *
     * @return the reference to read it back with
     */
    public String save(RawContent content) throws IOException {
        MediaType type;
        try {
            type = content.contentType() == null ? MediaType.OCTET_STREAM : MediaType.parse(content.contentType());
        } catch (IllegalArgumentException e) {
            type = MediaType.OCTET_STREAM;
        }
        WarcResource record = new WarcResource.Builder(content.url().toURI())
                .date(content.fetchedAt())
                .recordId(uuidGenerator.construct(content.fetchedAt().toEpochMilli()))
                .body(type, content.body())
                .payloadDigest(sha1(content.body()))
                .addHeader(STRATEGY_HEADER, content.strategy().name())
                .addHeader(STATUS_HEADER, Integer.toString(content.status()))
                .build();

        WarcRotator rotator;
        try {
            rotator = warcPool.takeFirst();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException(e);
        }
        try {
            return rotator.append(record);
        } finally {
            // put it back at the front of the pool to minimize the number of active files
            warcPool.addFirst(rotator);
        }
    }

    /**
     * Reads archived content back by reference.
     */
    public RawContent load(String ref) throws IOException {
        int at = ref.lastIndexOf('@');
        if (at <= 0) throw new IllegalArgumentException("Malformed raw content reference: " + ref);
        String filename = ref.substring(0, at);
        long offset = Long.parseLong(ref.substring(at + 1));
        if (filename.contains("/") || filename.contains("\\")) {
            throw new IllegalArgumentException("Raw content reference outside the archive: " + ref);
        }
        try (var reader = new WarcReader(warcsDir.resolve(filename))) {
            reader.position(offset);
            WarcRecord record = reader.next().orElseThrow(() -> new IOException("No record at " + ref));
            if (!(record instanceof WarcResource resource)) {
                throw new IOException("Expected a resource record at " + ref + " but found " + record.type());
            }
            byte[] body = resource.body().stream().readAllBytes();
            var strategy = Strategy.valueOf(resource.headers().first(STRATEGY_HEADER).orElse("DIRECT"));
            int status = Integer.parseInt(resource.headers().first(STATUS_HEADER).orElse("200"));
            return new RawContent(new Url(resource.targetURI().toString()), resource.contentType().toString(),
                    body, status, strategy, resource.date());
        }
    }

    private WarcDigest sha1(byte[] data) {
        try {
            var digest = MessageDigest.getInstance("SHA-1");
            digest.update(data);
            return new WarcDigest(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public void close() throws IOException {
        for (int i = 0; i < poolSize; i++) {
            try {
                warcPool.take().close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing WARC files");
                return;
            }
        }
    }
}
