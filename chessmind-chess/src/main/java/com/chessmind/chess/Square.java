package com.chessmind.chess;

/**
 * Square helpers. Squares are indexed {@code 0..63} with a1 = 0, b1 = 1, ..., h8 = 63.
 */
public final class Square {

    public static final int COUNT = 64;
    public static final int NONE = -1;

    public static final int A1 = 0;
    public static final int C1 = 2;
    public static final int D1 = 3;
    public static final int E1 = 4;
    public static final int F1 = 5;
    public static final int G1 = 6;
    public static final int H1 = 7;
    public static final int A8 = 56;
    public static final int C8 = 58;
    public static final int D8 = 59;
    public static final int E8 = 60;
    public static final int F8 = 61;
    public static final int G8 = 62;
    public static final int H8 = 63;

    private Square() {
    }

    public static int of(int file, int rank) {
        if (!isOnBoard(file, rank)) {
            throw new IllegalArgumentException("Square out of range: file " + file + ", rank " + rank);
        }
        return rank * 8 + file;
    }

    public static boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    public static int file(int square) {
        return square & 7;
    }

    public static int rank(int square) {
        return square >>> 3;
    }

    /**
     * Reflects the square across the horizontal centre line (a1 to a8).
     */
    public static int mirror(int square) {
        return square ^ 56;
    }

    public static boolean isLight(int square) {
        return ((file(square) + rank(square)) & 1) == 1;
    }

    public static String name(int square) {
        if (square < 0 || square >= COUNT) {
            throw new IllegalArgumentException("Square out of range: " + square);
        }
        return "" + (char) ('a' + file(square)) + (char) ('1' + rank(square));
    }

    public static int parse(String name) {
        if (name == null || name.length() != 2) {
            throw new IllegalArgumentException("Invalid square: " + name);
        }
        int file = name.charAt(0) - 'a';
        int rank = name.charAt(1) - '1';
        if (!isOnBoard(file, rank)) {
            throw new IllegalArgumentException("Invalid square: " + name);
        }
        return of(file, rank);
    }
}
