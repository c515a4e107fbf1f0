package com.pharmafinder.matcher.service;

/**
 * Ratcliff/Obershelp "gestalt" similarity: twice the number of characters found in
 * recursively matched longest common blocks, divided by the total length.
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    public static double ratio(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        // longest common block; earliest in a, then earliest in b, on ties
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLo] + 1;
                    current[j - bLo + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
