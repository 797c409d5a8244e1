package oscar.provisioning.service.storage;

/**
 * Bucket and optional folder of a binding path. Leading and trailing spaces and slashes are
 * trimmed, then the path is split on the first remaining slash.
 */
public record StoragePath(String bucket, String folder) {

    public static StoragePath parse(String rawPath) {
        String path = trim(rawPath == null ? "" : rawPath);
        int slash = path.indexOf('/');
        if (slash < 0) {
            return new StoragePath(path, null);
        }
        return new StoragePath(path.substring(0, slash), path.substring(slash + 1));
    }

    public boolean hasFolder() {
        return folder != null && !folder.isEmpty();
    }

    /** Key of the zero-byte object that materializes the folder, e.g. {@code sub/dir/}. */
    public String folderKey() {
        return hasFolder() ? folder + "/" : null;
    }

    /** Bucket and folder joined back together, without surrounding slashes. */
    public String fullPath() {
        return hasFolder() ? bucket + "/" + folder : bucket;
    }

    private static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isTrimmed(value.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmed(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isTrimmed(char c) {
        return c == ' ' || c == '/';
    }
}
