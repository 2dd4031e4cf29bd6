package ae.teletronics.attachment.domain;

/**
 * Inclusive byte range.
 */
public record SizeRange(long min, long max) {

    public SizeRange {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid size range " + min + ".." + max);
        }
    }

    /**
     * Parses the {@code min..max} notation.
     */
    public static SizeRange parse(String text) {
        if (text == null) throw new IllegalArgumentException("Size range is required");
        int dots = text.indexOf("..");
        if (dots < 0) throw new IllegalArgumentException("Size range must look like min..max: " + text);
        try {
            long min = Long.parseLong(text.substring(0, dots).strip());
            long max = Long.parseLong(text.substring(dots + 2).strip());
            return new SizeRange(min, max);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Size range must look like min..max: " + text, e);
        }
    }

    public boolean includes(long size) {
        return size >= min && size <= max;
    }

    @Override
    public String toString() {
        return min + ".." + max;
    }
}
