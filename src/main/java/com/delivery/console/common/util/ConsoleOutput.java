package com.delivery.console.common.util;

public final class ConsoleOutput {
    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    private ConsoleOutput() {
    }

    public static String green(String text) {
        return GREEN + text + RESET;
    }

    public static void printGreen(String text) {
        System.out.print(green(text));
    }

    public static void printlnGreen(String text) {
        System.out.println(green(text));
    }

    public static String red(String text) {
        return RED + text + RESET;
    }

    public static void printlnRed(String text) {
        System.out.println(red(text));
    }
}
