/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

/** Check-digit algorithms for Brazilian identifiers and payment cards. Input must be ASCII digits. */
public final class CheckDigits {
    private static final int[] CPF_FIRST = {10, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CPF_SECOND = {11, 10, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CNPJ_FIRST = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CNPJ_SECOND = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    private CheckDigits() {}

    /** 11 digits, both mod-11 check digits match, not a repeated-digit sequence. */
    public static boolean isValidCpf(String digits) {
        if (digits == null || digits.length() != 11 || !allDigits(digits) || allSame(digits)) return false;
        return mod11(digits, CPF_FIRST) == digit(digits, 9) && mod11(digits, CPF_SECOND) == digit(digits, 10);
    }

    /** 14 digits, both mod-11 check digits match, not a repeated-digit sequence. */
    public static boolean isValidCnpj(String digits) {
        if (digits == null || digits.length() != 14 || !allDigits(digits) || allSame(digits)) return false;
        return mod11(digits, CNPJ_FIRST) == digit(digits, 12) && mod11(digits, CNPJ_SECOND) == digit(digits, 13);
    }

    public static boolean luhn(String digits) {
        if (digits == null || digits.isEmpty() || !allDigits(digits)) return false;
        int sum = 0;
        boolean dbl = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (dbl) {
                d += d;
                if (d > 9) d -= 9;
            }
            sum += d;
            dbl = !dbl;
        }
        return sum % 10 == 0;
    }

    /** 11 - (weighted sum mod 11); results 10 and 11 collapse to 0. */
    static int mod11(String digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) sum += digit(digits, i) * weights[i];
        int check = 11 - (sum % 11);
        return check >= 10 ? 0 : check;
    }

    /** Strips everything but ASCII digits. */
    public static String digitsOf(CharSequence s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    private static int digit(String s, int i) {
        return s.charAt(i) - '0';
    }

    private static boolean allDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private static boolean allSame(String s) {
        for (int i = 1; i < s.length(); i++) {
            if (s.charAt(i) != s.charAt(0)) return false;
        }
        return true;
    }
}
