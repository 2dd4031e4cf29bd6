package ae.teletronics.attachment.domain;

import java.util.regex.Pattern;

public final class Filenames {

    // Both separators are handled so Windows paths are stripped on any OS.
    private static final Pattern LEADING_PATH = Pattern.compile("^.*[\\\\/]");
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9.\\-]");

    private Filenames() {}

    /**
     * Reduces a client supplied name to its last path segment and replaces every character
     * other than letters, digits, dot and hyphen with an underscore. Null stays null.
     */
    public static String sanitize(String filename) {
        if (filename == null) return null;
        String name = LEADING_PATH.matcher(filename.strip()).replaceFirst("");
        return UNSAFE_CHARS.matcher(name).replaceAll("_");
    }
}
