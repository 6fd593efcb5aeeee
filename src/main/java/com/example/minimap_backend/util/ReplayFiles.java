package com.example.minimap_backend.util;

import java.util.Locale;

/**
 * Naming rules shared by uploads, the renderer and every download of a rendered video.
 */
public final class ReplayFiles {

    public static final String REPLAY_EXTENSION = ".wowsreplay";
    public static final String VIDEO_EXTENSION = ".mp4";
    public static final String METADATA_SUFFIX = "-builds.json";
    private static final String FALLBACK_STEM = "render";

    private ReplayFiles() {
    }

    public static boolean isReplay(String filename) {
        return filename != null
                && filename.toLowerCase(Locale.ROOT).endsWith(REPLAY_EXTENSION)
                && filename.length() > REPLAY_EXTENSION.length();
    }

    /** File name without its last extension; {@code "render"} when nothing usable is left. */
    public static String stem(String filename) {
        if (filename == null || filename.isBlank()) {
            return FALLBACK_STEM;
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    public static String videoName(String filename) {
        return stem(filename) + VIDEO_EXTENSION;
    }

    public static String metadataName(String filename) {
        return stem(filename) + METADATA_SUFFIX;
    }
}
