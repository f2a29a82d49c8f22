package com.questrail.archon.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the {@code [CONFIG]} section of an Archon configuration (ACF) file.
 *
 * <p>Only lines inside {@code [CONFIG]} are returned, in file order, which is
 * the order they are numbered in configuration memory. Double quotes are
 * removed and backslashes become forward slashes, the form the controller
 * expects on the wire ({@code MOD1\XVN_V1="1.5"} becomes {@code MOD1/XVN_V1=1.5}).</p>
 */
public final class AcfReader
{
    private static final String CONFIG_SECTION = "[CONFIG]";

    private AcfReader() {}

    public static List<Map.Entry<String, String>> read(Path acf) throws IOException {
        try (Reader reader = Files.newBufferedReader(acf, StandardCharsets.ISO_8859_1)) {
            return read(reader);
        }
    }

    public static List<Map.Entry<String, String>> read(Reader reader) throws IOException {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        BufferedReader in = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        boolean inConfig = false;
        String raw;
        while ((raw = in.readLine()) != null) {
            String line = raw.trim();
            if (line.startsWith("[")) {
                inConfig = line.equalsIgnoreCase(CONFIG_SECTION);
                continue;
            }
            if (!inConfig || line.isEmpty()) {
                continue;
            }
            String clean = line.replace("\"", "").replace('\\', '/');
            int eq = clean.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            entries.add(Map.entry(clean.substring(0, eq), clean.substring(eq + 1)));
        }
        return entries;
    }
}
