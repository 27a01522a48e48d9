package webscan.crawler;

import java.util.Locale;
import java.util.Set;

/**
 * Static-asset and tooling-directory filter for discovered URLs.
 */
public final class UrlFilter {

    private static final Set<String> IGNORED_EXTENSIONS = Set.of(
        // Images
        "jpg", "jpeg", "png", "gif", "bmp", "ico", "svg", "webp",
        // Styles and scripts
        "css", "less", "scss", "sass", "js", "map", "json", "xml",
        // Fonts
        "woff", "woff2", "ttf", "eot",
        // Documents
        "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx",
        // Archives
        "zip", "rar", "tar", "gz", "7z",
        // Media
        "mp3", "mp4", "avi", "mov", "wmv", "flv", "ogg", "webm",
        // Binaries
        "exe", "dll", "bin", "dat", "dmg", "iso", "jar", "war", "ear", "swf", "torrent"
    );

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
        "__macosx", ".git", ".svn", ".hg", ".bzr", ".idea", ".vscode",
        "node_modules", "bower_components", "vendor",
        "logs", "log", "temp", "tmp", "cache", "caches"
    );

    private UrlFilter() {
    }

    /**
     * @param path raw URL path
     * @return true if the URL should not be crawled or scanned
     */
    public static boolean isIgnored(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return hasIgnoredExtension(lower) || hasIgnoredDirectory(lower);
    }

    static boolean hasIgnoredExtension(String lowerPath) {
        int slash = lowerPath.lastIndexOf('/');
        String lastSegment = lowerPath.substring(slash + 1);
        int dot = lastSegment.lastIndexOf('.');
        return dot >= 0 && IGNORED_EXTENSIONS.contains(lastSegment.substring(dot + 1));
    }

    static boolean hasIgnoredDirectory(String lowerPath) {
        for (String segment : lowerPath.split("/")) {
            if (IGNORED_DIRECTORIES.contains(segment)) {
                return true;
            }
        }
        return false;
    }
}
