package com.libragraph.depot.util;

import java.util.Set;

/**
 * Path-safe naming for archive entries and download file names.
 */
public final class EntryNames {

    private static final char REPLACEMENT = '_';

    private EntryNames() {}

    /**
     * Makes a single path-safe name segment.
     *
     * <p>Path separators, {@code :} and control characters become {@code _};
     * {@code .}, {@code ..} and blank names become {@code _}.
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return String.valueOf(REPLACEMENT);
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '/' || c == '\\' || c == ':' || Character.isISOControl(c)) {
                sb.append(REPLACEMENT);
            } else {
                sb.append(c);
            }
        }
        String result = sb.toString();
        if (result.equals(".") || result.equals("..")) {
            return String.valueOf(REPLACEMENT);
        }
        return result;
    }

    /**
     * Returns {@code name}, or {@code name (n).ext} with the lowest free n when
     * {@code name} is already taken, and records the result in {@code used}.
     */
    public static String uniquify(String name, Set<String> used) {
        if (used.add(name)) {
            return name;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        for (int n = 1; ; n++) {
            String candidate = base + " (" + n + ")" + ext;
            if (used.add(candidate)) {
                return candidate;
            }
        }
    }
}
