package org.fuselex.lexer.fuse;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Static metadata a host uses to list a lexer and to pick it for a file.
 *
 * @param title The display name.
 * @param description A one-line description.
 * @param tag The canonical short name.
 * @param filenames File name globs, e.g. {@code *.fuse}.
 * @param mimetypes Recognized MIME types.
 */
public record LexerDescriptor(
        String title,
        String description,
        String tag,
        List<String> filenames,
        List<String> mimetypes
) {
    public LexerDescriptor {
        filenames = List.copyOf(filenames);
        mimetypes = List.copyOf(mimetypes);
    }

    /**
     * Checks a file name (a path is reduced to its last element) against the globs.
     * @param fileName The file name.
     * @return {@code true} if any glob matches.
     */
    public boolean matchesFileName(String fileName) {
        Path name;
        try {
            name = Path.of(fileName).getFileName();
        } catch (InvalidPathException e) {
            return false;
        }
        if (name == null) {
            return false;
        }
        for (String glob : filenames) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param mimetype A MIME type, parameters such as {@code ;charset=utf-8} are ignored.
     * @return {@code true} if the type is one of this lexer's types.
     */
    public boolean matchesMimeType(String mimetype) {
        int semicolon = mimetype.indexOf(';');
        String bare = (semicolon >= 0 ? mimetype.substring(0, semicolon) : mimetype).trim().toLowerCase(Locale.ROOT);
        return mimetypes.contains(bare);
    }
}
