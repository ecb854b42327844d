package com.bytecache.path;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Builds sharded relative paths for file-backed storage of cache keys.
 *
 * A key is split into short leading slices that become directories, so that
 * no single directory collects every blob:
 * <pre>
 *   "FSHFJKDS" -> FS/HF/JK/FSHFJKDS
 *   "FSHFJKDS" -> FS/HF/JK/FSHFJKDS.meta   (metadata)
 * </pre>
 */
public class PathGen {

    /** Default number of subdirectories, e.g. FS/HF/JK. */
    public static final int DEFAULT_SUBDIRS = 3;

    /** Default subdirectory name length. */
    public static final int DEFAULT_SUBDIR_LEN = 2;

    public static final String META_SUFFIX = "meta";

    private final Path base;

    public PathGen(String key, int subdirs, int subdirLen) {
        this.base = construct(key, subdirs, subdirLen);
    }

    public static PathGen withDefaults(String key) {
        return new PathGen(key, DEFAULT_SUBDIRS, DEFAULT_SUBDIR_LEN);
    }

    /**
     * @return path to the binary blob, or null for an empty key
     */
    public Path filePath() {
        return base;
    }

    /**
     * @return path to the blob metadata, or null for an empty key
     */
    public Path metaPath() {
        if (base == null) {
            return null;
        }
        // construct always ends in the non-empty key, so there is a file name
        Path fileName = base.getFileName();
        return base.resolveSibling(fileName + "." + META_SUFFIX);
    }

    /**
     * Replace characters that cannot appear in a file name.
     */
    public static String replaceInvalidPathChars(String key) {
        return key.replace('/', '_').replace('\\', '_');
    }

    /**
     * Construct a relative path for the key.
     *
     * @param key       Cache key
     * @param subdirs   Maximum number of subdirectories to generate
     * @param subdirLen Length of each subdirectory name
     * @return the path, or null if the key is empty
     */
    public static Path construct(String key, int subdirs, int subdirLen) {
        if (key == null || key.isEmpty()) {
            return null;
        }
        if (subdirs < 0 || subdirLen < 0) {
            throw new IllegalArgumentException(
                    "Subdirectory count and length must not be negative, got: " + subdirs + ", " + subdirLen);
        }

        String name = replaceInvalidPathChars(key);
        int[] codePoints = name.codePoints().toArray();

        Path path = null;
        int offset = 0;
        if (subdirLen > 0) {
            for (int i = 0; i < subdirs; i++) {
                int nextOffset = offset + subdirLen;
                if (nextOffset > codePoints.length) {
                    break;
                }
                String dir = new String(codePoints, offset, subdirLen);
                path = path == null ? Paths.get(dir) : path.resolve(dir);
                offset = nextOffset;
            }
        }

        return path == null ? Paths.get(name) : path.resolve(name);
    }

    public static Path constructDefault(String key) {
        return construct(key, DEFAULT_SUBDIRS, DEFAULT_SUBDIR_LEN);
    }
}
