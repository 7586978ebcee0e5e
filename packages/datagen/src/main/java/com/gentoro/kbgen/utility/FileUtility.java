package com.gentoro.kbgen.utility;

import com.gentoro.kbgen.exception.IoException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

public class FileUtility {

  public static Path ensureDirectory(Path dir) {
    try {
      return Files.createDirectories(dir);
    } catch (IOException e) {
      throw new IoException("Failed to create directory: " + dir, e);
    }
  }

  public static void writeString(Path file, String content) {
    try {
      if (file.getParent() != null) Files.createDirectories(file.getParent());
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write file: " + file, e);
    }
  }

  /** Delete {@code dir} and everything below it; a missing directory is not an error. */
  public static void deleteDir(Path dir) {
    if (!Files.exists(dir)) return;
    try (Stream<Path> paths = Files.walk(dir)) {
      paths
          .sorted(Comparator.reverseOrder()) // children first
          .forEach(
              path -> {
                try {
                  Files.delete(path);
                } catch (IOException e) {
                  throw new IoException("Failed to delete file: " + path, e);
                }
              });
    } catch (IOException e) {
      throw new IoException("Failed to delete directory: " + dir, e);
    }
  }

  /**
   * Move {@code source} to {@code target}, replacing a previous {@code target} directory. The
   * final rename is atomic where the file system supports it.
   */
  public static Path replaceDirectory(Path source, Path target) {
    deleteDir(target);
    try {
      try {
        return Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        return Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new IoException("Failed to move " + source + " to " + target, e);
    }
  }

  public static String readString(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read file: " + file, e);
    }
  }
}
