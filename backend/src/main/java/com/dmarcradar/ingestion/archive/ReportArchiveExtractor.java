package com.dmarcradar.ingestion.archive;

import com.dmarcradar.ingestion.InvalidReportInputException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Turns an uploaded report attachment into XML text. The binary signature decides the format, not the
 * claimed extension: mail providers routinely send gzip files named .zip and the reverse.
 * ZIP archives are read with Commons Compress (central directory) and, on a format error, again with the
 * JDK streaming reader (local headers), which copes with archives whose central directory is damaged.
 */
@Component
@Slf4j
public class ReportArchiveExtractor {

    private static final Set<String> TEXT_EXTENSIONS = Set.of("xml", "txt");
    private static final List<String> FORMAT_ERROR_HINTS = List.of(
            "signature", "central directory", "header", "not a zip", "truncated", "unexpected end");

    public String extract(byte[] content, String extension) {
        if (content == null || content.length == 0) {
            throw new InvalidReportInputException("Invalid file buffer");
        }
        String ext = normalizeExtension(extension);
        if (TEXT_EXTENSIONS.contains(ext)) {
            return new String(content, StandardCharsets.UTF_8);
        }
        if (isGzip(content)) {
            if (!"gz".equals(ext)) {
                log.debug("GZIP signature found in file labeled .{}; decompressing as gzip", ext);
            }
            return new String(gunzip(content), StandardCharsets.UTF_8);
        }
        if (isZip(content)) {
            if (!"zip".equals(ext)) {
                log.debug("ZIP signature found in file labeled .{}; extracting as zip", ext);
            }
            return unzip(content);
        }
        if ("gz".equals(ext)) {
            return new String(gunzip(content), StandardCharsets.UTF_8);
        }
        if ("zip".equals(ext)) {
            return unzip(content);
        }
        throw new InvalidReportInputException("Unsupported file type: " + (ext.isEmpty() ? "unknown" : ext));
    }

    static boolean isZip(byte[] content) {
        return content.length >= 4 && content[0] == 'P' && content[1] == 'K';
    }

    static boolean isGzip(byte[] content) {
        return content.length >= 2 && (content[0] & 0xff) == 0x1f && (content[1] & 0xff) == 0x8b;
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String ext = extension.strip().toLowerCase(Locale.ROOT);
        int dot = ext.lastIndexOf('.');
        return dot >= 0 ? ext.substring(dot + 1) : ext;
    }

    byte[] gunzip(byte[] content) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return in.readAllBytes();
        } catch (IOException gzipError) {
            log.debug("gunzip failed ({}), trying raw inflate", gzipError.getMessage());
            byte[] inflated = inflate(content, false);
            if (inflated == null) {
                inflated = inflate(content, true);
            }
            if (inflated == null) {
                throw new InvalidReportInputException("Failed to decompress gzip file", gzipError);
            }
            return inflated;
        }
    }

    private static byte[] inflate(byte[] content, boolean nowrap) {
        Inflater inflater = new Inflater(nowrap);
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(content), inflater)) {
            byte[] out = in.readAllBytes();
            return out.length > 0 ? out : null;
        } catch (IOException e) {
            return null;
        } finally {
            inflater.end();
        }
    }

    private String unzip(byte[] content) {
        List<ArchiveEntry> entries;
        try {
            entries = readWithCommonsCompress(content);
        } catch (IOException primaryError) {
            if (!isFormatError(primaryError)) {
                throw new InvalidReportInputException("ZIP processing failed: " + primaryError.getMessage(), primaryError);
            }
            log.warn("Primary ZIP reader rejected archive ({}), retrying with streaming reader", primaryError.getMessage());
            entries = readWithZipInputStream(content);
            if (entries == null) {
                if (isGzip(content)) {
                    return new String(gunzip(content), StandardCharsets.UTF_8);
                }
                throw new InvalidReportInputException("Failed to read ZIP archive", primaryError);
            }
        }
        return selectEntry(entries);
    }

    private String selectEntry(List<ArchiveEntry> entries) {
        if (entries.isEmpty()) {
            throw new InvalidReportInputException("ZIP archive is empty");
        }
        for (ArchiveEntry e : entries) {
            if (e.lowerName().endsWith(".xml")) {
                return new String(e.data(), StandardCharsets.UTF_8);
            }
        }
        for (ArchiveEntry e : entries) {
            if (e.lowerName().endsWith(".gz")) {
                return new String(gunzip(e.data()), StandardCharsets.UTF_8);
            }
        }
        ArchiveEntry first = entries.get(0);
        log.debug("No .xml or .gz entry in ZIP archive, using {}", first.name());
        return new String(first.data(), StandardCharsets.UTF_8);
    }

    private static List<ArchiveEntry> readWithCommonsCompress(byte[] content) throws IOException {
        List<ArchiveEntry> entries = new ArrayList<>();
        try (ZipFile zip = ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(content)).get()) {
            for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
                if (entry.isDirectory()) {
                    continue;
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    entries.add(new ArchiveEntry(entry.getName(), in.readAllBytes()));
                }
            }
        }
        return entries;
    }

    /**
     * Returns null when the stream reader cannot read a single entry either.
     */
    private static List<ArchiveEntry> readWithZipInputStream(byte[] content) {
        List<ArchiveEntry> entries = new ArrayList<>();
        boolean sawEntry = false;
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                sawEntry = true;
                if (!entry.isDirectory()) {
                    entries.add(new ArchiveEntry(entry.getName(), in.readAllBytes()));
                }
            }
        } catch (IOException e) {
            log.warn("Streaming ZIP reader failed: {}", e.getMessage());
            return entries.isEmpty() ? null : entries;
        }
        return sawEntry ? entries : null;
    }

    private static boolean isFormatError(IOException e) {
        if (e instanceof ZipException) {
            return true;
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return FORMAT_ERROR_HINTS.stream().anyMatch(message::contains);
    }

    private record ArchiveEntry(String name, byte[] data) {

        String lowerName() {
            return name == null ? "" : name.toLowerCase(Locale.ROOT);
        }
    }
}
