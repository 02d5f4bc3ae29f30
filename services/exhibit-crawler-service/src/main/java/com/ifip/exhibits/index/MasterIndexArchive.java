package com.ifip.exhibits.index;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

public final class MasterIndexArchive {

    static final String ENTRY_NAME = "master.idx";
    static final int HEADER_LINES = 11;

    private MasterIndexArchive() {
    }

    public static boolean isIndexArchive(byte[] archive) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            return seekEntry(zip) != null;
        } catch (IOException e) {
            return false;
        }
    }

    public static List<String> readDataLines(byte[] archive) {
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            if (seekEntry(zip) == null) {
                throw new IllegalArgumentException("Index archive has no " + ENTRY_NAME + " entry");
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(zip, StandardCharsets.ISO_8859_1));
            List<String> lines = new ArrayList<>();
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                if (lineNumber++ < HEADER_LINES) {
                    continue;
                }
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    lines.add(trimmed);
                }
            }
            return lines;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read index archive", e);
        }
    }

    private static ZipEntry seekEntry(ZipInputStream zip) throws IOException {
        ZipEntry entry;
        while ((entry = zip.getNextEntry()) != null) {
            if (ENTRY_NAME.equals(entry.getName())) {
                return entry;
            }
        }
        return null;
    }
}
