package com.libragraph.batchsim.formats.fits;


import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the header cards of one HDU of a FITS file.
 *
 * <p>Values are returned as {@link Boolean}, {@link Long}, {@link Double} or {@link String}.
 * COMMENT, HISTORY and blank cards are skipped.
 */
public final class FitsHeaderReader {

    private FitsHeaderReader() {
    }

    /**
     * @param path FITS file
     * @param hdu  zero-based HDU index (0 = primary)
     * @throws UncheckedIOException if the file cannot be read or the HDU does not exist
     */
    public static Map<String, Object> read(Path path, int hdu) {
        if (hdu < 0) {
            throw new IllegalArgumentException("hdu must be >= 0, got: " + hdu);
        }
        try (InputStream raw = Files.newInputStream(path);
             DataInputStream in = new DataInputStream(raw)) {
            for (int i = 0; i < hdu; i++) {
                Map<String, Object> skipped = readHeader(in);
                skipFully(in, dataLength(skipped));
            }
            return readHeader(in);
        } catch (EOFException e) {
            throw new UncheckedIOException("HDU " + hdu + " not found in " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read FITS header from " + path, e);
        }
    }

    private static Map<String, Object> readHeader(DataInputStream in) throws IOException {
        Map<String, Object> header = new LinkedHashMap<>();
        byte[] block = new byte[FitsCards.BLOCK_SIZE];
        while (true) {
            in.readFully(block);
            String text = new String(block, StandardCharsets.US_ASCII);
            for (int off = 0; off < text.length(); off += FitsCards.CARD_LENGTH) {
                String card = text.substring(off, off + FitsCards.CARD_LENGTH);
                String keyword = card.substring(0, 8).trim();
                if (keyword.equals("END")) {
                    return header;
                }
                if (keyword.isEmpty() || keyword.equals("COMMENT") || keyword.equals("HISTORY")
                        || card.length() < 10 || !card.startsWith("= ", 8)) {
                    continue;
                }
                header.put(keyword, parseValue(card.substring(10)));
            }
        }
    }

    static Object parseValue(String field) {
        String s = field.trim();
        if (s.startsWith("'")) {
            StringBuilder sb = new StringBuilder();
            int i = 1;
            while (i < s.length()) {
                char c = s.charAt(i);
                if (c == '\'') {
                    if (i + 1 < s.length() && s.charAt(i + 1) == '\'') {
                        sb.append('\'');
                        i += 2;
                        continue;
                    }
                    break;
                }
                sb.append(c);
                i++;
            }
            return stripTrailing(sb.toString());
        }
        int slash = s.indexOf('/');
        if (slash >= 0) {
            s = s.substring(0, slash).trim();
        }
        if (s.equals("T")) {
            return Boolean.TRUE;
        }
        if (s.equals("F")) {
            return Boolean.FALSE;
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            // not an integer, try floating point below
        }
        try {
            return Double.parseDouble(s.replace('D', 'E'));
        } catch (NumberFormatException e) {
            return s;
        }
    }

    private static long dataLength(Map<String, Object> header) {
        int bitpix = ((Number) header.getOrDefault("BITPIX", 8L)).intValue();
        int naxis = ((Number) header.getOrDefault("NAXIS", 0L)).intValue();
        if (naxis == 0) {
            return 0;
        }
        long elements = 1;
        for (int i = 1; i <= naxis; i++) {
            elements *= ((Number) header.getOrDefault("NAXIS" + i, 0L)).longValue();
        }
        long pcount = ((Number) header.getOrDefault("PCOUNT", 0L)).longValue();
        long gcount = ((Number) header.getOrDefault("GCOUNT", 1L)).longValue();
        long bytes = Math.abs(bitpix) / 8 * gcount * (pcount + elements);
        return FitsCards.paddedLength(bytes);
    }

    private static void skipFully(DataInputStream in, long n) throws IOException {
        long remaining = n;
        while (remaining > 0) {
            long skipped = in.skip(remaining);
            if (skipped <= 0) {
                if (in.read() < 0) {
                    throw new EOFException();
                }
                skipped = 1;
            }
            remaining -= skipped;
        }
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ' ') {
            end--;
        }
        return s.substring(0, end);
    }
}
