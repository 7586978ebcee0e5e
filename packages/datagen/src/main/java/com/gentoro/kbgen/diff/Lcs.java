package com.gentoro.kbgen.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Longest common subsequence over two lists, by {@link Object#equals}. */
final class Lcs {
  private Lcs() {}

  /** Matched index pairs {@code [i, j]} in ascending order of both indices. */
  static <T> List<int[]> matches(List<T> a, List<T> b) {
    int n = a.size();
    int m = b.size();
    int[][] len = new int[n + 1][m + 1];
    for (int i = n - 1; i >= 0; i--) {
      for (int j = m - 1; j >= 0; j--) {
        len[i][j] =
            Objects.equals(a.get(i), b.get(j))
                ? len[i + 1][j + 1] + 1
                : Math.max(len[i + 1][j], len[i][j + 1]);
      }
    }
    List<int[]> out = new ArrayList<>();
    int i = 0;
    int j = 0;
    while (i < n && j < m) {
      if (Objects.equals(a.get(i), b.get(j))) {
        out.add(new int[] {i, j});
        i++;
        j++;
      } else if (len[i + 1][j] >= len[i][j + 1]) {
        i++;
      } else {
        j++;
      }
    }
    return out;
  }
}
