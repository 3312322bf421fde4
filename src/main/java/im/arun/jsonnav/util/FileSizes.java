package im.arun.jsonnav.util;

import java.util.Locale;

public final class FileSizes {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileSizes() {}

    /**
     * Formats a byte count such as {@code 1536} as {@code 1.5 KB}.
     */
    public static String readable(long bytes) {
        double len = bytes;
        int order = 0;
        while (len >= 1024 && order < UNITS.length - 1) {
            order++;
            len /= 1024;
        }
        String number = String.format(Locale.ROOT, "%.2f", len);
        // drop trailing zeros: 1.50 -> 1.5, 2.00 -> 2
        number = number.replaceAll("\\.?0+$", "");
        return number + " " + UNITS[order];
    }
}
