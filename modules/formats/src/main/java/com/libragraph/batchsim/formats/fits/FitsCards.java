package com.libragraph.batchsim.formats.fits;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the 80-column header cards of one HDU.
 */
final class FitsCards {

    static final int CARD_LENGTH = 80;
    static final int BLOCK_SIZE = 2880;

    private final List<String> cards = new ArrayList<>();

    FitsCards logical(String keyword, boolean value) {
        return fixed(keyword, value ? "T" : "F");
    }

    FitsCards integer(String keyword, long value) {
        return fixed(keyword, Long.toString(value));
    }

    FitsCards string(String keyword, String value) {
        String quoted = "'" + padRight(value.replace("'", "''"), 8) + "'";
        cards.add(padRight(padRight(keyword, 8) + "= " + quoted, CARD_LENGTH));
        return this;
    }

    /**
     * Returns the header bytes, END card included, padded with blanks to a block boundary.
     */
    byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        for (String card : cards) {
            sb.append(card);
        }
        sb.append(padRight("END", CARD_LENGTH));
        long padded = paddedLength(sb.length());
        while (sb.length() < padded) {
            sb.append(' ');
        }
        return sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    static long paddedLength(long length) {
        long blocks = (length + BLOCK_SIZE - 1) / BLOCK_SIZE;
        return blocks * BLOCK_SIZE;
    }

    private FitsCards fixed(String keyword, String value) {
        // fixed format: value right-justified in columns 11-30
        String card = padRight(keyword, 8) + "= " + padLeft(value, 20);
        cards.add(padRight(card, CARD_LENGTH));
        return this;
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        return s + " ".repeat(width - s.length());
    }

    private static String padLeft(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        return " ".repeat(width - s.length()) + s;
    }
}
