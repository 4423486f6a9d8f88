package ru.xodavit.deadsimple.framework.guava;

/**
 * from Guava library
 */
public final class Bytes {
  private Bytes() {
  }

  public static int indexOf(byte[] array, byte[] target) {
    return indexOf(array, target, 0, array.length);
  }

  /**
   * @return index of the first occurrence of {@code target} in {@code array[start, end)}, or -1
   */
  public static int indexOf(byte[] array, byte[] target, int start, int end) {
    if (target.length == 0) {
      return start;
    }

    outer:
    for (int i = Math.max(start, 0); i < end - target.length + 1; i++) {
      for (int j = 0; j < target.length; j++) {
        if (array[i + j] != target[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }
}
