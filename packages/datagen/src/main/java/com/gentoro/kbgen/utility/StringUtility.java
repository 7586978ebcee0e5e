package com.gentoro.kbgen.utility;

import com.gentoro.kbgen.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class StringUtility {
  private static final Pattern UNSAFE_PATH_CHARS = Pattern.compile("[/\\\\:*?\"<>|()\\[\\]#%]");

  /**
   * Normalize a display string into a filesystem and link safe slug: lowercase, whitespace runs to
   * a single underscore, reserved path characters replaced. Blank input yields {@code "unnamed"}.
   */
  public static String slug(String input) {
    if (input == null) return "unnamed";
    String out =
        UNSAFE_PATH_CHARS
            .matcher(input.trim().toLowerCase(Locale.ROOT))
            .replaceAll("_")
            .replaceAll("\\s+", "_")
            .replaceAll("_+", "_");
    return out.isEmpty() || out.equals("_") ? "unnamed" : out;
  }

  /** {@code "works_at"} becomes {@code "Works At"}. */
  public static String humanize(String key) {
    if (key == null || key.isBlank()) return "";
    return Arrays.stream(key.trim().split("[_\\s]+"))
        .filter(s -> !s.isEmpty())
        .map(s -> Character.toUpperCase(s.charAt(0)) + s.substring(1))
        .collect(Collectors.joining(" "));
  }

  /** {@code "works_at"} becomes {@code "works at"}, used inside sentences. */
  public static String phrase(String key) {
    if (key == null) return "";
    return key.replace('_', ' ').trim();
  }

  public static String formatWithIndent(String input, int indent) {
    if (input == null) return "";
    if (indent < 0) indent = 0;
    String spaces = " ".repeat(indent);
    String formatted = input.replaceAll("\\r\\n?", "\n").trim();
    return Arrays.stream(formatted.split("\n"))
        .map(line -> spaces + line)
        .collect(Collectors.joining("\n"));
  }

  /** Extract the body of a fenced code block of the given type (e.g. {@code json}). */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)(?:```%s\\s*)(.+?)(?:\\s*```)".formatted(type);
    Pattern pattern = Pattern.compile(regex);
    Matcher matcher = pattern.matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }

  /**
   * Best effort extraction of a JSON object from free text: a fenced {@code json} block first, then
   * the outermost braces.
   */
  public static String extractJsonObject(String text) {
    if (text == null) return null;
    String fenced = extractSnippet(text, "json");
    if (fenced != null) return fenced;
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) return null;
    return text.substring(start, end + 1);
  }

  /** First {@code length} hex digits of the SHA-256 of {@code input}. */
  public static String shortHash(String input, int length) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder();
      for (byte b : hash) {
        String h = Integer.toHexString(0xff & b);
        if (h.length() == 1) hex.append('0');
        hex.append(h);
        if (hex.length() >= length) break;
      }
      return hex.substring(0, Math.min(length, hex.length()));
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 algorithm not available", e);
    }
  }
}
