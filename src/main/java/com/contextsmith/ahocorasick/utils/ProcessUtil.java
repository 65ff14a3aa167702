package com.contextsmith.ahocorasick.utils;

public class ProcessUtil {

  private static final long MB = 1024 * 1024;

  public static String getHeapConsumption() {
    Runtime runtime = Runtime.getRuntime();
    long heapSize = runtime.totalMemory() / MB;
    long freeSize = runtime.freeMemory() / MB;
    long heapMaxSize = runtime.maxMemory() / MB;
    return String.format("%d/%d/%d MB Used",
                         heapSize - freeSize, heapSize, heapMaxSize);
  }

  private ProcessUtil() {
  }
}
