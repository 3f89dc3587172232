package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.Finding;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalized keys used to decide which findings describe the same issue.
 */
public final class FindingKeyUtil {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FindingKeyUtil() {
    }

    /**
     * Lower-cases the title and collapses whitespace runs to a single space.
     */
    @Nonnull
    public static String normalizeTitle(@Nullable String title) {
        if (title == null) {
            return "";
        }
        return WHITESPACE.matcher(title.trim()).replaceAll(" ").toLowerCase(Locale.ENGLISH);
    }

    @Nullable
    public static String normalizePath(@Nullable String path) {
        if (path == null) {
            return null;
        }
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    /**
     * Bucket a finding falls into before line overlap is considered. Located findings share a
     * bucket per file and category; file-level and repo-wide findings also key on the title.
     */
    @Nonnull
    public static String bucketKey(@Nonnull Finding finding) {
        Objects.requireNonNull(finding, "finding");
        String category = finding.getCategory().name();
        if (finding.isRepoWide()) {
            return String.join("|", "repo", category, normalizeTitle(finding.getTitle()));
        }
        String file = normalizePath(finding.getLocationFile());
        if (finding.getLineRange() == null) {
            return String.join("|", "file", file, category, normalizeTitle(finding.getTitle()));
        }
        return String.join("|", "line", file, category);
    }

    /**
     * Stable digest of what a task for this finding is about, independent of its session id.
     * Written into task descriptions so repeated runs can be recognized in the tracker.
     */
    @Nonnull
    public static String fingerprint(@Nonnull Finding finding) {
        Objects.requireNonNull(finding, "finding");
        String range = finding.getLineRange() != null ? finding.getLineRange().asDisplay() : "";
        String payload = String.join("|",
                Objects.toString(normalizePath(finding.getLocationFile()), ""),
                range,
                finding.getSeverity().name(),
                finding.getCategory().label(),
                normalizeTitle(finding.getTitle()));
        return sha256(payload);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
